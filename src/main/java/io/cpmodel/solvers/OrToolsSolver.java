// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.cpmodel.solvers;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.ortools.Loader;
import com.google.ortools.sat.AutomatonConstraint;
import com.google.ortools.sat.CircuitConstraint;
import com.google.ortools.sat.Constraint;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverSolutionCallback;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.CumulativeConstraint;
import com.google.ortools.sat.IntervalVar;
import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.sat.Literal;
import com.google.ortools.sat.SatParameters;
import com.google.ortools.sat.TableConstraint;
import com.google.ortools.util.Domain;
import io.cpmodel.Model;
import io.cpmodel.exceptions.ConfigurationException;
import io.cpmodel.exceptions.InvalidModelException;
import io.cpmodel.exceptions.NotSupportedException;
import io.cpmodel.exceptions.PreconditionException;
import io.cpmodel.exceptions.UnknownStatusException;
import io.cpmodel.exceptions.UnsupportedExpressionException;
import io.cpmodel.expressions.Abs;
import io.cpmodel.expressions.BoolVal;
import io.cpmodel.expressions.BoolVar;
import io.cpmodel.expressions.Circuit;
import io.cpmodel.expressions.Comparison;
import io.cpmodel.expressions.Constant;
import io.cpmodel.expressions.Cumulative;
import io.cpmodel.expressions.DirectConstraint;
import io.cpmodel.expressions.Element;
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Expressions;
import io.cpmodel.expressions.GlobalConstraint;
import io.cpmodel.expressions.GlobalFunction;
import io.cpmodel.expressions.IntVar;
import io.cpmodel.expressions.Inverse;
import io.cpmodel.expressions.NegBoolView;
import io.cpmodel.expressions.NegativeTable;
import io.cpmodel.expressions.NoOverlap;
import io.cpmodel.expressions.Operator;
import io.cpmodel.expressions.Regular;
import io.cpmodel.expressions.Table;
import io.cpmodel.expressions.Variable;
import io.cpmodel.transformations.CseMap;
import io.cpmodel.transformations.Flatten;
import io.cpmodel.transformations.SolverCapabilities;
import io.cpmodel.transformations.TransformPipeline;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Backend on the OR-Tools CP-SAT solver.
 *
 * <p>Constraints are brought into the flat normal form CP-SAT accepts and posted on a {@link
 * CpModel}. Variables get their native counterpart on first use. The solver supports
 * assumptions, solution hints and the enumeration of all solutions of a satisfaction problem.
 *
 * <p>Example:
 *
 * <pre>
 *   IntVar x = Expressions.intVar(0, 10, "x");
 *   OrToolsSolver solver = new OrToolsSolver();
 *   solver.add(x.gt(3));
 *   solver.minimize(x);
 *   if (solver.solve()) {
 *     System.out.println(x.value());
 *   }
 * </pre>
 */
public class OrToolsSolver implements SolverInterface {
  private static final Logger logger = Logger.getLogger(OrToolsSolver.class.getName());

  public static final String NAME = "ortools";

  /** What CP-SAT posts natively. */
  public static final SolverCapabilities CAPABILITIES =
      SolverCapabilities.newBuilder()
          .setSupportedGlobals(
              "min",
              "max",
              "abs",
              "element",
              "alldifferent",
              "xor",
              "table",
              "negative_table",
              "cumulative",
              "circuit",
              "inverse",
              "no_overlap",
              "regular")
          .setReifiable("sum", "wsum")
          .setNumexprComparable("sum", "wsum", "sub")
          .setSafenToplevel("div", "mod")
          .build();

  private static final ImmutableSet<String> OBJECTIVE_OPERATORS =
      ImmutableSet.of("sum", "wsum", "sub");

  /** Returns true if the OR-Tools native libraries can be loaded. */
  public static boolean supported() {
    try {
      Loader.loadNativeLibraries();
      return true;
    } catch (LinkageError | RuntimeException e) {
      logger.fine("OR-Tools native libraries unavailable: " + e);
      return false;
    }
  }

  public OrToolsSolver() {
    this(null, null, ImmutableMap.of());
  }

  public OrToolsSolver(Model model) {
    this(model, null, ImmutableMap.of());
  }

  /**
   * Creates a solver and posts the constraints and objective of {@code model}, if any.
   *
   * @param subsolver must be null, CP-SAT has no sub-solvers
   * @param options {@link SatParameters} fields by name, such as {@code num_workers}
   */
  public OrToolsSolver(Model model, String subsolver, Map<String, ?> options) {
    if (subsolver != null) {
      throw new ConfigurationException(
          "OrToolsSolver", "no sub-solver available, got " + subsolver);
    }
    Loader.loadNativeLibraries();
    this.ortModel = new CpModel();
    this.ortSolver = new CpSolver();
    NativeParameters.apply(ortSolver.getParameters(), options, "OrToolsSolver");
    if (model != null) {
      add(model.constraints());
      if (model.objective() != null) {
        objective(model.objective(), model.isMinimize());
      }
    }
  }

  @Override
  public String name() {
    return NAME;
  }

  /** Returns the native model. */
  public CpModel nativeModel() {
    return ortModel;
  }

  /** Returns the native parameters, applied at each solve. */
  public SatParameters.Builder parameters() {
    return ortSolver.getParameters();
  }

  @Override
  public OrToolsSolver add(Iterable<? extends Expression> constraints) {
    ImmutableList<Expression> list = ImmutableList.copyOf(constraints);
    userVars.addAll(Expressions.getVariables(list));
    List<Expression> posted = transform(list);
    for (Expression c : posted) {
      post(c);
    }
    return this;
  }

  @Override
  public OrToolsSolver add(Expression... constraints) {
    return add(Arrays.asList(constraints));
  }

  @Override
  public List<Expression> transform(Iterable<? extends Expression> constraints) {
    return TransformPipeline.transform(constraints, CAPABILITIES, cse);
  }

  @Override
  public void objective(Expression expr, boolean minimize) {
    List<Expression> defining = new ArrayList<>();
    Expression flat = Flatten.flattenObjective(expr, OBJECTIVE_OPERATORS, defining, cse);
    userVars.addAll(Expressions.getVariables(expr));
    for (Expression c : transform(defining)) {
      post(c);
    }
    LinearArgument objective = makeNumexpr(flat);
    if (minimize) {
      ortModel.minimize(objective);
    } else {
      ortModel.maximize(objective);
    }
  }

  @Override
  public boolean hasObjective() {
    return ortModel.hasObjective();
  }

  @Override
  public boolean solve(
      Double timeLimit, List<? extends BoolVar> assumptions, Map<String, ?> params) {
    return solveInternal("solve", timeLimit, assumptions, params, null, false);
  }

  @Override
  public int solveAll(
      Runnable display, Double timeLimit, Integer solutionLimit, Map<String, ?> params) {
    if (hasObjective()) {
      throw new NotSupportedException(
          "solveAll",
          "OR-Tools does not enumerate the solutions of an optimization problem, use solve()");
    }
    OrToolsSolutionPrinter printer =
        new OrToolsSolutionPrinter(varmap, userVars, display, solutionLimit);
    SatParameters.Builder parameters = ortSolver.getParameters();
    parameters.setEnumerateAllSolutions(true);
    try {
      solveInternal("solveAll", timeLimit, null, params, printer, true);
    } finally {
      parameters.setEnumerateAllSolutions(false);
    }
    return printer.getSolutionCount();
  }

  @Override
  public void solutionHint(List<? extends Variable> vars, List<? extends Number> vals) {
    if (vars.size() != vals.size()) {
      throw new ConfigurationException(
          "solutionHint",
          "got " + vars.size() + " variables but " + vals.size() + " values");
    }
    ortModel.clearHints();
    for (int i = 0; i < vars.size(); ++i) {
      Variable var = vars.get(i);
      long value = vals.get(i).longValue();
      LinearArgument handle = solverVar(var);
      if (var instanceof BoolVar) {
        ortModel.addHint((Literal) handle, value != 0);
      } else {
        ortModel.addHint((com.google.ortools.sat.IntVar) handle, value);
      }
    }
  }

  @Override
  public ImmutableList<BoolVar> getCore() {
    if (status.exitStatus() != ExitStatus.UNSATISFIABLE) {
      throw new PreconditionException(
          "getCore", "the last solve must be unsatisfiable, got " + status.exitStatus());
    }
    if (assumptionMap == null) {
      throw new PreconditionException(
          "getCore", "the last solve had no assumptions, use solve(null, assumptions, params)");
    }
    ImmutableList.Builder<BoolVar> core = ImmutableList.builder();
    for (int index : ortSolver.sufficientAssumptionsForInfeasibility()) {
      core.add(assumptionMap.get(index));
    }
    return core.build();
  }

  @Override
  public SolverStatus status() {
    return status;
  }

  @Override
  public Number objectiveValue() {
    return objectiveValue;
  }

  @Override
  public ImmutableSet<Variable> userVariables() {
    return ImmutableSet.copyOf(userVars);
  }

  /**
   * Returns the native handle of a variable or constant: a CP-SAT variable, created on first use,
   * a literal or a constant expression.
   */
  public LinearArgument solverVar(Expression expr) {
    if (expr instanceof Constant) {
      return LinearExpr.constant(((Constant) expr).get());
    }
    if (expr instanceof BoolVal) {
      return ((BoolVal) expr).get() ? ortModel.trueLiteral() : ortModel.falseLiteral();
    }
    if (expr instanceof NegBoolView) {
      return ((Literal) solverVar(((NegBoolView) expr).variable())).not();
    }
    if (expr instanceof Variable) {
      Variable var = (Variable) expr;
      LinearArgument handle = varmap.get(var);
      if (handle == null) {
        handle =
            var instanceof BoolVar
                ? ortModel.newBoolVar(var.name())
                : ortModel.newIntVar(var.lb(), var.ub(), var.name());
        varmap.put(var, handle);
      }
      return handle;
    }
    throw new UnsupportedExpressionException("solverVar", "not a variable or constant", expr);
  }

  private boolean solveInternal(
      String methodName,
      Double timeLimit,
      List<? extends BoolVar> assumptions,
      Map<String, ?> params,
      CpSolverSolutionCallback callback,
      boolean enumerating) {
    if (timeLimit != null && !(timeLimit > 0)) {
      throw new ConfigurationException(
          methodName, "time limit must be positive, got " + timeLimit);
    }
    for (Variable var : userVars) {
      solverVar(var);
    }
    SatParameters.Builder parameters = ortSolver.getParameters();
    if (timeLimit != null) {
      parameters.setMaxTimeInSeconds(timeLimit);
    }
    ortModel.clearAssumptions();
    assumptionMap = null;
    if (assumptions != null) {
      assumptionMap = new HashMap<>();
      Literal[] literals = new Literal[assumptions.size()];
      for (int i = 0; i < literals.length; ++i) {
        literals[i] = solverLiteral(assumptions.get(i));
        assumptionMap.put(literals[i].getIndex(), assumptions.get(i));
      }
      ortModel.addAssumptions(literals);
      parameters.setKeepAllFeasibleSolutionsInPresolve(true);
    }
    NativeParameters.apply(parameters, params, methodName);
    if (parameters.getLogSearchProgress()) {
      ortSolver.setLogCallback(logger::info);
    } else {
      ortSolver.clearLogCallback();
    }

    // Values of an earlier solve must not survive a failing one.
    for (Variable var : userVars) {
      var.clearValue();
    }
    objectiveValue = null;
    CpSolverStatus ortStatus =
        callback == null ? ortSolver.solve(ortModel) : ortSolver.solve(ortModel, callback);
    status =
        new SolverStatus(
            NAME, exitStatus(methodName, ortStatus, enumerating), ortSolver.wallTime());
    logger.fine("OR-Tools returned " + ortStatus + ", " + status);

    if (status.hasSolution()) {
      for (Variable var : userVars) {
        LinearArgument handle = varmap.get(var);
        if (var instanceof BoolVar) {
          ((BoolVar) var).setBooleanValue(ortSolver.booleanValue((Literal) handle));
        } else {
          var.setValue(ortSolver.value(handle));
        }
      }
      objectiveValue = hasObjective() ? toNumber(ortSolver.objectiveValue()) : null;
    }
    return status.hasSolution();
  }

  private ExitStatus exitStatus(String methodName, CpSolverStatus ortStatus, boolean enumerating) {
    switch (ortStatus) {
      case OPTIMAL:
        // Without objective, OPTIMAL means a solution exists, or all were found when enumerating.
        return hasObjective() || enumerating ? ExitStatus.OPTIMAL : ExitStatus.FEASIBLE;
      case FEASIBLE:
        return ExitStatus.FEASIBLE;
      case INFEASIBLE:
        return ExitStatus.UNSATISFIABLE;
      case UNKNOWN:
        return ExitStatus.UNKNOWN;
      case MODEL_INVALID:
        throw new InvalidModelException(methodName, ortModel.validate());
      default:
        throw new UnknownStatusException(methodName, "unknown OR-Tools status " + ortStatus);
    }
  }

  private static Number toNumber(double value) {
    if (!Double.isInfinite(value) && value == Math.rint(value)) {
      return (long) value;
    }
    return value;
  }

  private Literal solverLiteral(Expression expr) {
    LinearArgument handle = solverVar(expr);
    if (!(handle instanceof Literal)) {
      throw new UnsupportedExpressionException("solverLiteral", "not a Boolean", expr);
    }
    return (Literal) handle;
  }

  private Literal[] solverLiterals(List<Expression> exprs) {
    Literal[] literals = new Literal[exprs.size()];
    for (int i = 0; i < literals.length; ++i) {
      literals[i] = solverLiteral(exprs.get(i));
    }
    return literals;
  }

  private LinearArgument[] solverVars(List<Expression> exprs) {
    LinearArgument[] handles = new LinearArgument[exprs.size()];
    for (int i = 0; i < handles.length; ++i) {
      handles[i] = solverVar(exprs.get(i));
    }
    return handles;
  }

  private com.google.ortools.sat.IntVar[] solverIntVars(List<Expression> exprs) {
    com.google.ortools.sat.IntVar[] vars = new com.google.ortools.sat.IntVar[exprs.size()];
    for (int i = 0; i < vars.length; ++i) {
      Expression e = exprs.get(i);
      if (e instanceof Constant) {
        vars[i] = ortModel.newConstant(((Constant) e).get());
        continue;
      }
      LinearArgument handle = solverVar(e);
      if (!(handle instanceof com.google.ortools.sat.IntVar)) {
        throw new UnsupportedExpressionException("solverIntVars", "not an integer variable", e);
      }
      vars[i] = (com.google.ortools.sat.IntVar) handle;
    }
    return vars;
  }

  /** Returns the native linear expression of a flat sum, weighted sum, subtraction or leaf. */
  private LinearArgument makeNumexpr(Expression expr) {
    if (Expressions.isLeaf(expr)) {
      return solverVar(expr);
    }
    if (expr instanceof Operator) {
      Operator op = (Operator) expr;
      LinearExprBuilder builder = LinearExpr.newBuilder();
      List<Expression> args = op.args();
      switch (op.kind()) {
        case SUM:
          for (Expression arg : args) {
            builder.add(solverVar(arg));
          }
          return builder;
        case WSUM:
          for (int i = 0; i < args.size(); ++i) {
            builder.addTerm(solverVar(args.get(i)), op.weights().get(i));
          }
          return builder;
        case SUB:
          return builder.add(solverVar(args.get(0))).addTerm(solverVar(args.get(1)), -1);
        case NEG:
          return builder.addTerm(solverVar(args.get(0)), -1);
        default:
          break;
      }
    }
    throw new UnsupportedExpressionException("makeNumexpr", "not a linear expression", expr);
  }

  private static boolean isLinear(Expression expr) {
    if (Expressions.isLeaf(expr)) {
      return true;
    }
    if (!(expr instanceof Operator)) {
      return false;
    }
    switch (((Operator) expr).kind()) {
      case SUM:
      case WSUM:
      case SUB:
      case NEG:
        return true;
      default:
        return false;
    }
  }

  /** Posts one flat constraint. A reified constraint must accept an enforcement literal. */
  private Constraint post(Expression expr) {
    return post(expr, false);
  }

  private Constraint post(Expression expr, boolean reified) {
    if (expr instanceof BoolVal || expr instanceof Variable) {
      return ortModel.addBoolOr(new Literal[] {solverLiteral(expr)});
    }
    if (expr instanceof Operator) {
      Operator op = (Operator) expr;
      switch (op.kind()) {
        case AND:
          return ortModel.addBoolAnd(solverLiterals(op.args()));
        case OR:
          return ortModel.addBoolOr(solverLiterals(op.args()));
        case IMPLIES:
          {
            if (reified) {
              break;
            }
            Literal condition = solverLiteral(op.args().get(0));
            Expression conclusion = op.args().get(1);
            if (conclusion instanceof Variable) {
              return ortModel.addImplication(condition, solverLiteral(conclusion));
            }
            Constraint ct = post(conclusion, true);
            ct.onlyEnforceIf(condition);
            return ct;
          }
        default:
          break;
      }
    }
    if (expr instanceof Comparison) {
      return postComparison((Comparison) expr, reified);
    }
    if (!reified && expr instanceof GlobalConstraint) {
      return postGlobal((GlobalConstraint) expr);
    }
    if (!reified && expr instanceof DirectConstraint) {
      return ((DirectConstraint) expr).post(ortModel, this::solverVar);
    }
    throw new UnsupportedExpressionException(
        "post", reified ? "cannot post as reified constraint" : "cannot post", expr);
  }

  private Constraint postComparison(Comparison c, boolean reified) {
    Expression lhs = c.lhs();
    if (isLinear(lhs)) {
      LinearArgument left = makeNumexpr(lhs);
      LinearArgument right = solverVar(c.rhs());
      switch (c.op()) {
        case EQ:
          return ortModel.addEquality(left, right);
        case NE:
          return ortModel.addDifferent(left, right);
        case LT:
          return ortModel.addLessThan(left, right);
        case LE:
          return ortModel.addLessOrEqual(left, right);
        case GT:
          return ortModel.addGreaterThan(left, right);
        case GE:
          return ortModel.addGreaterOrEqual(left, right);
      }
    }
    if (c.op() != Comparison.Op.EQ) {
      throw new UnsupportedExpressionException(
          "postComparison", "only equality is supported for " + lhs.name(), c);
    }
    if (reified) {
      throw new UnsupportedExpressionException(
          "postComparison", lhs.name() + " cannot be reified", c);
    }
    LinearArgument target = solverVar(c.rhs());
    if (lhs instanceof Operator) {
      List<Expression> args = lhs.args();
      switch (((Operator) lhs).kind()) {
        case MUL:
          return ortModel.addMultiplicationEquality(
              target, solverVar(args.get(0)), solverVar(args.get(1)));
        case DIV:
          return postDivision(target, args.get(0), args.get(1));
        case MOD:
          return postModulo(target, args.get(0), args.get(1));
        case POW:
          return postPower(target, args.get(0), args.get(1));
        default:
          break;
      }
    }
    if (lhs instanceof GlobalFunction) {
      switch (lhs.name()) {
        case "min":
          return ortModel.addMinEquality(target, solverVars(lhs.args()));
        case "max":
          return ortModel.addMaxEquality(target, solverVars(lhs.args()));
        case "abs":
          return ortModel.addAbsEquality(target, solverVar(lhs.args().get(0)));
        case "element":
          {
            Element element = (Element) lhs;
            return ortModel.addElement(
                solverVar(element.index()), solverVars(element.array()), target);
          }
        default:
          break;
      }
    }
    throw new UnsupportedExpressionException("postComparison", "cannot post", c);
  }

  /**
   * Posts {@code target == x / y}. CP-SAT rejects a divisor whose domain contains 0, so such a
   * divisor is copied into a variable over its non-zero values.
   */
  private Constraint postDivision(LinearArgument target, Expression x, Expression y) {
    LinearArgument divisor = solverVar(y);
    if (y.lb() <= 0 && y.ub() >= 0) {
      List<long[]> intervals = new ArrayList<>();
      if (y.lb() < 0) {
        intervals.add(new long[] {y.lb(), -1});
      }
      if (y.ub() > 0) {
        intervals.add(new long[] {1, y.ub()});
      }
      com.google.ortools.sat.IntVar nonZero =
          ortModel.newIntVarFromDomain(
              Domain.fromIntervals(intervals.toArray(new long[0][])), "nonzero(" + y + ")");
      ortModel.addEquality(nonZero, divisor);
      divisor = nonZero;
    }
    return ortModel.addDivisionEquality(target, solverVar(x), divisor);
  }

  /**
   * Posts {@code target == x % y}. CP-SAT needs a positive divisor; since the remainder takes the
   * sign of the dividend, {@code x % y == x % |y|}.
   */
  private Constraint postModulo(LinearArgument target, Expression x, Expression y) {
    LinearArgument divisor;
    if (y.lb() > 0) {
      divisor = solverVar(y);
    } else if (y.ub() < 0) {
      divisor = LinearExpr.term(solverVar(y), -1);
    } else {
      IntVar magnitude = new IntVar(1, Math.max(-y.lb(), y.ub()));
      for (Expression c : transform(ImmutableList.of(new Abs(y).eq(magnitude)))) {
        post(c);
      }
      divisor = solverVar(magnitude);
    }
    return ortModel.addModuloEquality(target, solverVar(x), divisor);
  }

  /** Posts {@code target == base ** exponent} as a chain of multiplications. */
  private Constraint postPower(LinearArgument target, Expression base, Expression exponent) {
    if (!(exponent instanceof Constant)) {
      throw new NotSupportedException(
          "postPower", "OR-Tools only supports constant exponents, got " + exponent);
    }
    long n = ((Constant) exponent).get();
    if (n == 0) {
      return ortModel.addEquality(target, LinearExpr.constant(1));
    }
    if (n == 1) {
      return ortModel.addEquality(target, solverVar(base));
    }
    Expression power = base;
    for (long k = 2; k < n; ++k) {
      List<Expression> defining = new ArrayList<>();
      power = Flatten.getOrMakeVar(power.times(base), defining, cse);
      for (Expression c : defining) {
        post(c);
      }
    }
    return ortModel.addMultiplicationEquality(target, solverVar(power), solverVar(base));
  }

  private Constraint postGlobal(GlobalConstraint gc) {
    switch (gc.name()) {
      case "alldifferent":
        return ortModel.addAllDifferent(solverVars(gc.args()));
      case "xor":
        return ortModel.addBoolXor(solverLiterals(gc.args()));
      case "table":
        {
          TableConstraint ct = ortModel.addAllowedAssignments(solverVars(gc.args()));
          ct.addTuples(((Table) gc).rows());
          return ct;
        }
      case "negative_table":
        {
          TableConstraint ct = ortModel.addForbiddenAssignments(solverVars(gc.args()));
          ct.addTuples(((NegativeTable) gc).rows());
          return ct;
        }
      case "regular":
        {
          Regular regular = (Regular) gc;
          AutomatonConstraint ct =
              ortModel.addAutomaton(
                  solverVars(gc.args()), regular.start(), regular.accepting());
          for (long[] t : regular.transitions()) {
            ct.addTransition((int) t[0], (int) t[2], t[1]);
          }
          return ct;
        }
      case "circuit":
        return postCircuit((Circuit) gc);
      case "inverse":
        {
          Inverse inverse = (Inverse) gc;
          return ortModel.addInverse(
              solverIntVars(inverse.fwd()), solverIntVars(inverse.rev()));
        }
      case "cumulative":
        {
          Cumulative cumulative = (Cumulative) gc;
          IntervalVar[] intervals =
              intervals(cumulative.start(), cumulative.duration(), cumulative.end());
          CumulativeConstraint ct = ortModel.addCumulative(solverVar(cumulative.capacity()));
          ct.addDemands(intervals, solverVars(cumulative.demand()));
          return ct;
        }
      case "no_overlap":
        {
          NoOverlap noOverlap = (NoOverlap) gc;
          return ortModel.addNoOverlap(
              intervals(noOverlap.start(), noOverlap.duration(), noOverlap.end()));
        }
      default:
        throw new UnsupportedExpressionException("postGlobal", "unknown global constraint", gc);
    }
  }

  /**
   * Posts a circuit over arc literals {@code arc[i][j] == (succ[i] == j)}. Self loops are
   * excluded, so every node has a successor other than itself.
   */
  private Constraint postCircuit(Circuit circuit) {
    List<Expression> succ = circuit.args();
    int n = succ.size();
    CircuitConstraint ct = ortModel.addCircuit();
    List<Expression> channels = new ArrayList<>();
    for (int i = 0; i < n; ++i) {
      for (int j = 0; j < n; ++j) {
        if (i == j || j < succ.get(i).lb() || j > succ.get(i).ub()) {
          continue;
        }
        BoolVar arc = new BoolVar();
        channels.add(arc.eq(succ.get(i).eq(j)));
        ct.addArc(i, j, solverLiteral(arc));
      }
    }
    for (Expression c : transform(channels)) {
      post(c);
    }
    return ct;
  }

  private IntervalVar[] intervals(
      List<Expression> start, List<Expression> duration, List<Expression> end) {
    IntervalVar[] intervals = new IntervalVar[start.size()];
    for (int i = 0; i < intervals.length; ++i) {
      intervals[i] =
          ortModel.newIntervalVar(
              solverVar(start.get(i)),
              solverVar(duration.get(i)),
              solverVar(end.get(i)),
              "interval#" + i);
    }
    return intervals;
  }

  private final CpModel ortModel;
  private final CpSolver ortSolver;
  private final CseMap cse = new CseMap();
  private final Map<Variable, LinearArgument> varmap = new HashMap<>();
  private final Set<Variable> userVars = new LinkedHashSet<>();
  private SolverStatus status = SolverStatus.notRun(NAME);
  private Number objectiveValue;
  private Map<Integer, BoolVar> assumptionMap;
}

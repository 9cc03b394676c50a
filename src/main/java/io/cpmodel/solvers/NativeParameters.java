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

import com.google.protobuf.Descriptors.EnumValueDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Message;
import com.google.protobuf.ProtocolMessageEnum;
import io.cpmodel.exceptions.ConfigurationException;
import java.util.Map;

/** Sets fields of a protobuf parameter message by name, such as {@code num_workers}. */
final class NativeParameters {
  static void apply(Message.Builder builder, Map<String, ?> params, String methodName) {
    for (Map.Entry<String, ?> param : params.entrySet()) {
      set(builder, param.getKey(), param.getValue(), methodName);
    }
  }

  static void set(Message.Builder builder, String name, Object value, String methodName) {
    FieldDescriptor field = builder.getDescriptorForType().findFieldByName(name);
    if (field == null) {
      throw new ConfigurationException(methodName, "unknown parameter " + name);
    }
    if (value == null) {
      throw new ConfigurationException(methodName, "missing value for parameter " + name);
    }
    try {
      if (field.isRepeated()) {
        if (!(value instanceof Iterable)) {
          throw new IllegalArgumentException("a list is expected");
        }
        builder.clearField(field);
        for (Object v : (Iterable<?>) value) {
          builder.addRepeatedField(field, convert(field, v));
        }
      } else {
        builder.setField(field, convert(field, value));
      }
    } catch (IllegalArgumentException | ClassCastException e) {
      throw new ConfigurationException(
          methodName, "invalid value " + value + " for parameter " + name, e);
    }
  }

  private static Object convert(FieldDescriptor field, Object value) {
    switch (field.getJavaType()) {
      case INT:
        return ((Number) value).intValue();
      case LONG:
        return ((Number) value).longValue();
      case FLOAT:
        return ((Number) value).floatValue();
      case DOUBLE:
        return ((Number) value).doubleValue();
      case BOOLEAN:
        return (Boolean) value;
      case STRING:
        return value.toString();
      case ENUM:
        {
          if (value instanceof ProtocolMessageEnum) {
            return ((ProtocolMessageEnum) value).getValueDescriptor();
          }
          EnumValueDescriptor enumValue =
              value instanceof Number
                  ? field.getEnumType().findValueByNumber(((Number) value).intValue())
                  : field.getEnumType().findValueByName(value.toString());
          if (enumValue == null) {
            throw new IllegalArgumentException("unknown enum value");
          }
          return enumValue;
        }
      default:
        throw new IllegalArgumentException("unsupported field type " + field.getJavaType());
    }
  }

  private NativeParameters() {}
}

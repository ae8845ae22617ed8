package me.golemcore.agentkernel.domain.grammar;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks decoded arguments against the subset of JSON Schema used by tool
 * parameter declarations: types, required and enumerated values, nested
 * properties and array items.
 */
final class ArgumentSchemaValidator {

    private ArgumentSchemaValidator() {
    }

    static List<String> validate(Map<String, Object> schema, Object value) {
        List<String> violations = new ArrayList<>();
        validate(schema, value, "$", violations);
        return violations;
    }

    @SuppressWarnings("unchecked")
    private static void validate(Map<String, Object> schema, Object value, String path, List<String> violations) {
        if (schema == null || schema.isEmpty()) {
            return;
        }
        Object type = schema.get("type");
        if (type instanceof String typeName && !matchesType(typeName, value)) {
            violations.add(path + ": expected " + typeName);
            return;
        }
        Object allowed = schema.get("enum");
        if (allowed instanceof Collection<?> values && !values.contains(value)) {
            violations.add(path + ": value not in enum " + values);
        }
        if (value instanceof Map<?, ?> object) {
            Object required = schema.get("required");
            if (required instanceof Collection<?> names) {
                for (Object name : names) {
                    if (!object.containsKey(name)) {
                        violations.add(path + ": missing required property '" + name + "'");
                    }
                }
            }
            Object properties = schema.get("properties");
            Map<String, Object> declared = properties instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
            for (Map.Entry<?, ?> entry : object.entrySet()) {
                Object propertySchema = declared.get(String.valueOf(entry.getKey()));
                if (propertySchema instanceof Map<?, ?> nested) {
                    validate((Map<String, Object>) nested, entry.getValue(), path + "." + entry.getKey(), violations);
                } else if (Boolean.FALSE.equals(schema.get("additionalProperties"))) {
                    violations.add(path + ": unexpected property '" + entry.getKey() + "'");
                }
            }
        }
        if (value instanceof List<?> array && schema.get("items") instanceof Map<?, ?> items) {
            for (int i = 0; i < array.size(); i++) {
                validate((Map<String, Object>) items, array.get(i), path + "[" + i + "]", violations);
            }
        }
    }

    private static boolean matchesType(String type, Object value) {
        return switch (type) {
        case "object" -> value instanceof Map;
        case "array" -> value instanceof List;
        case "string" -> value instanceof String;
        case "boolean" -> value instanceof Boolean;
        case "null" -> value == null;
        case "number" -> value instanceof Number;
        case "integer" -> isIntegral(value);
        default -> true;
        };
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }
}

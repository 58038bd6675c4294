/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Condition on one column of a grid query.
 *
 * <p>Either a single comparison or an AND/OR combination of single comparisons. On the wire the two
 * shapes are told apart by their fields ({@code type} versus {@code operator}/{@code conditions}).</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
@JsonSubTypes({
        @JsonSubTypes.Type(FilterCondition.Simple.class),
        @JsonSubTypes.Type(FilterCondition.Combined.class)
})
public sealed interface FilterCondition permits FilterCondition.Simple, FilterCondition.Combined {

    /**
     * @param filterType value domain: {@code text}, {@code number} or {@code date}
     * @param type comparison: {@code equals}, {@code notEqual}, {@code contains}, {@code notContains},
     *             {@code startsWith}, {@code endsWith}, {@code lessThan}, {@code greaterThan},
     *             {@code inRange}, {@code blank} or {@code notBlank}
     * @param filter operand
     * @param filterTo upper bound of {@code inRange}
     * @param dateFrom operand of date comparisons
     * @param dateTo upper bound of date {@code inRange}
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Simple(String filterType,
                  String type,
                  @Nullable Object filter,
                  @Nullable Object filterTo,
                  @Nullable String dateFrom,
                  @Nullable String dateTo)
            implements FilterCondition {

        public Simple {
            Objects.requireNonNull(filterType, "filterType");
            Objects.requireNonNull(type, "type");
        }

        public static Simple text(String type, @Nullable Object filter) {
            return new Simple("text", type, filter, null, null, null);
        }
    }

    /**
     * @param operator {@code AND} or {@code OR}
     */
    record Combined(String filterType,
                    String operator,
                    List<Simple> conditions)
            implements FilterCondition {

        public Combined {
            Objects.requireNonNull(filterType, "filterType");
            Objects.requireNonNull(operator, "operator");
            conditions = List.copyOf(Objects.requireNonNull(conditions, "conditions"));
        }

        public boolean isDisjunction() {
            return "OR".equalsIgnoreCase(operator);
        }
    }
}

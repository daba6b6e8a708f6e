package com.enterprise.orchestration.dependency;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Feeds one field of an upstream task's result into a parameter of the dependent task.
 * Candidate field names are tried in order; the first non-null value wins.
 */
public class ParameterBinding {
    
    private final String targetParameter;
    private final List<String> resultFields;
    
    @JsonCreator
    public ParameterBinding(@JsonProperty("targetParameter") String targetParameter,
                            @JsonProperty("resultFields") List<String> resultFields) {
        this.targetParameter = Objects.requireNonNull(targetParameter, "Target parameter cannot be null");
        if (resultFields == null || resultFields.isEmpty()) {
            throw new IllegalArgumentException("At least one result field is required for " + targetParameter);
        }
        this.resultFields = List.copyOf(resultFields);
    }
    
    public static ParameterBinding of(String targetParameter, String... resultFields) {
        return new ParameterBinding(targetParameter, List.of(resultFields));
    }
    
    public String getTargetParameter() {
        return targetParameter;
    }
    
    public List<String> getResultFields() {
        return resultFields;
    }
    
    /**
     * Extract the bound value from an upstream result
     */
    public Optional<Object> extract(Map<String, Object> upstreamResult) {
        if (upstreamResult == null) {
            return Optional.empty();
        }
        for (String field : resultFields) {
            Object value = upstreamResult.get(field);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterBinding that = (ParameterBinding) o;
        return targetParameter.equals(that.targetParameter) && resultFields.equals(that.resultFields);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(targetParameter, resultFields);
    }
    
    @Override
    public String toString() {
        return targetParameter + "<-" + resultFields;
    }
}

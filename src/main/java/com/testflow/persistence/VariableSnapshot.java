package com.testflow.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.testflow.model.VariableType;

/**
 * One Environment variable as text. The value is written with {@code String.valueOf}
 * and read back with {@link VariableType#parse}; a null value is omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class VariableSnapshot {

    private String       name;
    private VariableType type;
    private String       value;

    public VariableSnapshot() {
        this.type = VariableType.OBJECT;
    }

    public VariableSnapshot(String name, VariableType type, String value) {
        this.name  = name;
        this.type  = type;
        this.value = value;
    }

    public String       getName()  { return name; }
    public VariableType getType()  { return type; }
    public String       getValue() { return value; }

    public void setName(String name)       { this.name = name; }
    public void setType(VariableType type) { this.type = type; }
    public void setValue(String value)     { this.value = value; }
}

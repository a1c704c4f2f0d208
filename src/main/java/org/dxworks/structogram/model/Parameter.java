package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class Parameter {
    @JsonProperty("pos")
    public final String position;
    @JsonProperty("parName")
    public final String name;

    @JsonCreator
    public Parameter(@JsonProperty("pos") String position, @JsonProperty("parName") String name) {
        this.position = position;
        this.name = name;
    }
}

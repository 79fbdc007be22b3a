package com.e2eq.filter.rest.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Data
@EqualsAndHashCode
@SuperBuilder
@RegisterForReflection
@NoArgsConstructor
@ToString
public class RestError {
   protected int status;
   protected String statusMessage;
   protected String reasonMessage;
   protected String field;
   protected String operator;
   protected List<String> violations;
}

package com.platform.wafoperator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObjectReference(
    String apiVersion,
    String kind,
    String name,
    String namespace
) {
}

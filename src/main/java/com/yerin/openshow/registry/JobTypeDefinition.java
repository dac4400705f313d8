package com.yerin.openshow.registry;

public record JobTypeDefinition(String type, JobSchema schema, JobPolicy policy) {
}

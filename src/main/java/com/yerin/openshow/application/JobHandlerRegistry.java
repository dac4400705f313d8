package com.yerin.openshow.application;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class JobHandlerRegistry {
    private final Map<String, JobHandler> map;
    public JobHandlerRegistry(ObjectProvider<JobHandler> handlers) {
        this.map = handlers.orderedStream().collect(Collectors.toMap(JobHandler::type, h -> h));
    }
    public JobHandler get(String type) { return map.get(type); }
    public Set<String> types() { return map.keySet(); }
}

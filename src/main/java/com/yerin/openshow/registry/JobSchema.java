package com.yerin.openshow.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record JobSchema(List<String> requiredFields, Map<String, FieldKind> fieldKinds) {

    public JobSchema {
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        // 선언 순서를 유지해야 위반 목록이 항상 같은 순서로 나온다
        fieldKinds = fieldKinds == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fieldKinds));
    }
}

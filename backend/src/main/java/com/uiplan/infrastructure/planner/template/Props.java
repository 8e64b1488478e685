package com.uiplan.infrastructure.planner.template;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered prop maps. {@code Map.of} iteration order varies between JVM runs,
 * which would break byte-stable serialization, so templates build props here.
 */
public final class Props {

    private Props() {
    }

    public static Map<String, Object> of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Props.of expects key/value pairs");
        }
        Map<String, Object> props = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.put((String) keyValues[i], keyValues[i + 1]);
        }
        return props;
    }
}

package com.example.samifier.model;

import com.example.samifier.util.Values;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code Fn::Sub} with its template parsed into segments and an optional variable map.
 */
@Data
@AllArgsConstructor
public class Sub implements Intrinsic {
    public static final String FUNCTION = "Fn::Sub";

    private SubTemplate template;

    /**
     * Local variables of the list form, null for the plain string form
     */
    private Map<String, Object> variables;

    public Sub(String text) {
        this(SubTemplate.parse(text), null);
    }

    public boolean hasVariable(String name) {
        return variables != null && variables.containsKey(name);
    }

    @Override
    public String getFunctionName() {
        return FUNCTION;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Sub copy() {
        Map<String, Object> vars = variables == null ? null : (Map<String, Object>) Values.deepCopy(variables);
        return new Sub(template.copy(), vars == null ? null : new LinkedHashMap<>(vars));
    }
}

package com.example.samifier.fold.rules;

/**
 * Naming of API events on a function
 */
final class ApiEvents {

    private ApiEvents() {
    }

    /**
     * e.g. {@code ApiGetItemsId} for {@code GET /items/{id}}, {@code ApiAnyRoot} for {@code ANY /}
     */
    static String eventName(String prefix, String method, String path) {
        StringBuilder name = new StringBuilder(prefix).append(capitalize(method.toLowerCase()));
        boolean any = false;
        for (String part : path.split("[^A-Za-z0-9]+")) {
            if (!part.isEmpty()) {
                name.append(capitalize(part));
                any = true;
            }
        }
        if (!any) {
            name.append("Root");
        }
        return name.toString();
    }

    static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}

package com.enterprise.querybook.sql.query;

/**
 * A {@link Query} template could not be rendered.
 */
public class TemplateException extends IllegalStateException {

    public enum Reason { UNRESOLVED_VARIABLE, UNUSED_VARIABLE }

    private final Reason reason;
    private final String variableName;

    private TemplateException(Reason reason, String variableName, String message) {
        super(message);
        this.reason = reason;
        this.variableName = variableName;
    }

    public static TemplateException unresolvedVariable(String name, String template) {
        return new TemplateException(Reason.UNRESOLVED_VARIABLE, name,
                "Template references {:" + name + ":} but no value was set: " + template);
    }

    public static TemplateException unusedVariable(String name) {
        return new TemplateException(Reason.UNUSED_VARIABLE, name,
                "Variable '" + name + "' is set but not referenced by the template");
    }

    public Reason reason() {
        return reason;
    }

    public String variableName() {
        return variableName;
    }
}

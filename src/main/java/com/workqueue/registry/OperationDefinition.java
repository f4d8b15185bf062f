package com.workqueue.registry;

import java.util.List;

/**
 * A registered operation: its name, the kinds of its positional parameters and
 * the handler that runs it.
 */
public final class OperationDefinition {
    private final String domain;
    private final String name;
    private final List<ParamKind> parameterKinds;
    private final OperationHandler handler;

    OperationDefinition(String domain, String name, List<ParamKind> parameterKinds, OperationHandler handler) {
        this.domain = domain;
        this.name = name;
        this.parameterKinds = List.copyOf(parameterKinds);
        this.handler = handler;
    }

    public String getDomain() {
        return domain;
    }

    public String getName() {
        return name;
    }

    public List<ParamKind> getParameterKinds() {
        return parameterKinds;
    }

    /**
     * @return the number of positional arguments a job must supply
     */
    public int getArity() {
        return parameterKinds.size();
    }

    public OperationHandler getHandler() {
        return handler;
    }

    @Override
    public String toString() {
        return domain + "." + name + parameterKinds;
    }
}

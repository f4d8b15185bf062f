package com.workqueue.registry;

import com.workqueue.core.ValidationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Table of the operations jobs may invoke, grouped by domain.
 *
 * <p>One registry instance is created by the host and passed to the job service,
 * the cron service and the job runner. There is no global registry.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * OperationRegistry registry = new OperationRegistry();
 * registry.domain("Partner")
 *         .operation("NameGet", partners::nameGet)
 *         .operation("Write", partners::write, ParamKind.STRUCTURED);
 * }</pre>
 *
 * <p><b>Thread Safety:</b> registration and lookup may happen concurrently; the
 * underlying maps are concurrent.</p>
 */
public class OperationRegistry {
    private static final Logger logger = Logger.getLogger(OperationRegistry.class.getName());

    private final Map<String, Map<String, OperationDefinition>> domains = new ConcurrentHashMap<>();

    /**
     * Get a builder for the given domain, creating the domain if needed.
     *
     * @param name the domain name, e.g. "Partner"
     * @return a builder registering operations into that domain
     */
    public DomainBuilder domain(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Domain name must not be blank");
        }
        domains.computeIfAbsent(name, n -> new ConcurrentHashMap<>());
        return new DomainBuilder(name);
    }

    public boolean hasDomain(String name) {
        return name != null && domains.containsKey(name);
    }

    /**
     * Look up an operation.
     *
     * @param domain    the domain name
     * @param operation the operation name
     * @return the definition, or empty if either name is unknown
     */
    public Optional<OperationDefinition> find(String domain, String operation) {
        if (domain == null || operation == null) {
            return Optional.empty();
        }
        Map<String, OperationDefinition> operations = domains.get(domain);
        return operations == null ? Optional.empty() : Optional.ofNullable(operations.get(operation));
    }

    /**
     * Look up an operation, failing when it cannot be found.
     *
     * @param domain    the domain name
     * @param operation the operation name
     * @return the definition
     * @throws ValidationException if the domain or the operation is unknown
     */
    public OperationDefinition resolve(String domain, String operation) {
        if (!hasDomain(domain)) {
            throw new ValidationException("Unknown domain: " + domain);
        }
        return find(domain, operation).orElseThrow(() ->
                new ValidationException("Unknown operation in domain " + domain + ": " + operation));
    }

    public Set<String> domainNames() {
        return Collections.unmodifiableSet(new TreeSet<>(domains.keySet()));
    }

    /**
     * Registers operations into one domain.
     */
    public final class DomainBuilder {
        private final String domain;

        private DomainBuilder(String domain) {
            this.domain = domain;
        }

        /**
         * Register (or replace) an operation.
         *
         * @param name           operation name
         * @param handler        code to run
         * @param parameterKinds kinds of the positional parameters, in order
         * @return this builder
         */
        public DomainBuilder operation(String name, OperationHandler handler, ParamKind... parameterKinds) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Operation name must not be blank");
            }
            if (handler == null) {
                throw new IllegalArgumentException("Operation " + domain + "." + name + " needs a handler");
            }
            OperationDefinition definition =
                    new OperationDefinition(domain, name, Arrays.asList(parameterKinds), handler);
            domains.get(domain).put(name, definition);
            logger.fine("Registered operation " + definition);
            return this;
        }
    }
}

package com.workqueue.registry;

import java.util.List;
import java.util.Objects;

/**
 * The subjects an operation is applied to: ids of one domain, in the order given.
 */
public final class SubjectSet {
    private final String domain;
    private final List<Long> ids;

    public SubjectSet(String domain, List<Long> ids) {
        this.domain = domain;
        this.ids = List.copyOf(ids);
    }

    public String getDomain() {
        return domain;
    }

    public List<Long> getIds() {
        return ids;
    }

    public int size() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubjectSet)) {
            return false;
        }
        SubjectSet other = (SubjectSet) o;
        return domain.equals(other.domain) && ids.equals(other.ids);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, ids);
    }

    @Override
    public String toString() {
        return domain + ids;
    }
}

package com.keystone.database;

import com.keystone.security.OrgFilter;
import java.util.List;
import java.util.Optional;

/** Translates an {@link OrgFilter} into a SQL condition on an organization column. */
public final class OrgFilterSql {

    private OrgFilterSql() {
        // utility class
    }

    /**
     * The condition restricting {@code column} to the filter, appending its bind argument to
     * {@code args}. Empty for an unrestricted filter.
     */
    public static Optional<String> condition(OrgFilter filter, String column, List<Object> args) {
        switch (filter.mode()) {
            case GLOBAL_ONLY:
                return Optional.of(column + " IS NULL");
            case ORGANIZATION:
                args.add(filter.organizationId());
                return Optional.of(filter.includeGlobal()
                        ? "(" + column + " = ? OR " + column + " IS NULL)"
                        : column + " = ?");
            default:
                return Optional.empty();
        }
    }
}

package com.keystone.compliance;

import com.keystone.security.OrgFilter;

/** Read access to stored users for compliance reporting. */
@FunctionalInterface
public interface UserDirectory {

    UserStatistics statistics(OrgFilter scope);
}

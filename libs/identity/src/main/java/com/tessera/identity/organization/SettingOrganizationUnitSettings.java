package com.tessera.identity.organization;

import com.tessera.identity.settings.SettingNames;
import com.tessera.identity.settings.SettingProvider;

/**
 * Reads organization-unit policy from the setting provider, tenant value first, falling back to a
 * configured default.
 */
public class SettingOrganizationUnitSettings implements OrganizationUnitSettings {

    private final SettingProvider settingProvider;
    private final int defaultMaxUserMembershipCount;

    public SettingOrganizationUnitSettings(SettingProvider settingProvider, int defaultMaxUserMembershipCount) {
        if (defaultMaxUserMembershipCount < 1) {
            throw new IllegalArgumentException("defaultMaxUserMembershipCount must be positive");
        }
        this.settingProvider = settingProvider;
        this.defaultMaxUserMembershipCount = defaultMaxUserMembershipCount;
    }

    @Override
    public int getMaxUserMembershipCount(Long tenantId) {
        return settingProvider
                .getSettingValue(SettingNames.MAX_USER_MEMBERSHIP_COUNT, tenantId, Integer.class)
                .orElse(defaultMaxUserMembershipCount);
    }
}

package com.tessera.identity.settings;

/**
 * Names of the settings read by the identity services.
 */
public final class SettingNames {

    private SettingNames() {
        // constants
    }

    /** Maximum number of organization units a user may belong to. */
    public static final String MAX_USER_MEMBERSHIP_COUNT = "Tessera.OrganizationUnits.MaxUserMembershipCount";
}

package com.tessera.identity;

import java.util.Arrays;

/**
 * An error whose message is meant to be shown to the end user.
 *
 * <p>Carries a localization message key and its arguments. {@link #getMessage()} holds the
 * default (English) text so logs stay readable without a localization lookup.
 */
public class UserFriendlyException extends RuntimeException {

    private final String messageKey;
    private final Object[] args;

    /**
     * @param messageKey     localization key (e.g., "Identity.DuplicateUserName")
     * @param defaultMessage format string used when no localized text is available
     * @param args           arguments for both the localized and the default text
     */
    public UserFriendlyException(String messageKey, String defaultMessage, Object... args) {
        super(defaultMessage.formatted(args));
        this.messageKey = messageKey;
        this.args = args.clone();
    }

    public String messageKey() {
        return messageKey;
    }

    public Object[] args() {
        return args.clone();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + messageKey + Arrays.toString(args) + "]: " + getMessage();
    }
}

package com.flagship.bookkeeping.setting;

/**
 * Keys of the {@code user_setting} table.
 */
public enum SettingKey {
    USER_NAME,
    CURRENCY_DOMESTIC
}

package com.colorcorrection.model.settings;

import lombok.ToString;

/**
 * White balance has no options beyond the common diagnostics toggles.
 */
@ToString(callSuper = true)
public class WhiteBalanceSettings extends StageSettings {
}

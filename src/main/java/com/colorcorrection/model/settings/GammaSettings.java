package com.colorcorrection.model.settings;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Gamma correction options.
 */
@Getter
@Setter
@ToString(callSuper = true)
public class GammaSettings extends StageSettings {

    /** Highest polynomial degree tried when fitting the tone curve. */
    private int maxDegree = 5;
}

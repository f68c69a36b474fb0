package com.colorcorrection.model.settings;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Flat-field correction options.
 */
@Getter
@Setter
@ToString(callSuper = true)
public class FlatFieldSettings extends StageSettings {

    private boolean manualCrop = false;
    private int bins = 50;
    private int smoothWindow = 5;
    private int degree = 3;
    private String fitMethod = "pls";
    private boolean interactions = true;
    private int maxIter = 1000;
    private double tol = 1e-8;
    private boolean verbose = false;
    private int randomSeed = 0;
}

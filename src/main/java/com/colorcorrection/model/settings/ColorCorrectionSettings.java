package com.colorcorrection.model.settings;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Color correction model options. The neural-network fields are only read
 * when {@code mtd} is {@code nn}.
 */
@Getter
@Setter
@ToString(callSuper = true)
public class ColorCorrectionSettings extends StageSettings {

    private String ccMethod = "ours";
    private String method = "Finlayson 2015";
    private String mtd = "pls";
    private int degree = 2;
    private int maxIterations = 10000;
    private int randomState = 0;
    private double tol = 1e-8;
    private boolean verbose = false;
    private boolean paramSearch = false;

    @JsonProperty("n_samples")
    private int sampleCount = 50;

    private int ncomp = 1;
    private int nlayers = 100;
    private List<Integer> hiddenLayers = new ArrayList<>(List.of(64, 32, 16));
    private double learningRate = 0.001;
    private int batchSize = 16;
    private int patience = 10;
    private double dropoutRate = 0.2;
    private String optimType = "adam";
    private boolean useBatchNorm = true;
}

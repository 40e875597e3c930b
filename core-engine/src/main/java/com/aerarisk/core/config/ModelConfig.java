package com.aerarisk.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the model parameters YAML.
 *
 * <p>
 * Expected YAML structure (every section and key is optional; omitted values
 * keep the defaults shown):
 * </p>
 *
 * <pre>
 * modelName: aera-level3
 * scoring:
 *   householdWeight: 0.4
 *   householdCap: 3.2
 * kmeans:
 *   minClusters: 2
 *   maxClusters: 6
 * dbscan:
 *   eps: 1.25
 * isolationForest:
 *   contamination: 0.05
 * drift:
 *   windowDays: 30
 *   acceleratingThreshold: 0.25
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelConfig {

    private String modelName = "aera-level3";
    private Scoring scoring = new Scoring();
    private KMeans kmeans = new KMeans();
    private Dbscan dbscan = new Dbscan();
    private IsolationForest isolationForest = new IsolationForest();
    private Drift drift = new Drift();

    /**
     * @return a configuration holding only the built-in defaults
     */
    public static ModelConfig defaults() {
        return new ModelConfig();
    }

    /**
     * Validate every section, collecting all problems into one exception.
     *
     * @throws ConfigurationException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (modelName == null || modelName.isBlank()) {
            errors.add("'modelName' is required");
        }
        if (scoring == null || kmeans == null || dbscan == null
                || isolationForest == null || drift == null) {
            errors.add("Configuration sections must not be null");
        } else {
            scoring.validate(errors);
            kmeans.validate(errors);
            dbscan.validate(errors);
            isolationForest.validate(errors);
            drift.validate(errors);
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Model configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** Risk score weights. */
    public static class Scoring {
        private double householdWeight = 0.4;
        private double householdCap = 3.2;
        private double medicationWeight = 1.8;
        private double insulinWeight = 2.2;
        private double oxygenDeviceWeight = 2.5;
        private double mobilityWeight = 1.5;
        private double noTransportationWeight = 1.2;
        private double financialStrainWeight = 1.4;

        void validate(List<String> errors) {
            if (householdWeight < 0 || householdCap < 0 || medicationWeight < 0 || insulinWeight < 0
                    || oxygenDeviceWeight < 0 || mobilityWeight < 0 || noTransportationWeight < 0
                    || financialStrainWeight < 0) {
                errors.add("Scoring weights must be >= 0");
            }
        }

        public double getHouseholdWeight() {
            return householdWeight;
        }

        public void setHouseholdWeight(double householdWeight) {
            this.householdWeight = householdWeight;
        }

        public double getHouseholdCap() {
            return householdCap;
        }

        public void setHouseholdCap(double householdCap) {
            this.householdCap = householdCap;
        }

        public double getMedicationWeight() {
            return medicationWeight;
        }

        public void setMedicationWeight(double medicationWeight) {
            this.medicationWeight = medicationWeight;
        }

        public double getInsulinWeight() {
            return insulinWeight;
        }

        public void setInsulinWeight(double insulinWeight) {
            this.insulinWeight = insulinWeight;
        }

        public double getOxygenDeviceWeight() {
            return oxygenDeviceWeight;
        }

        public void setOxygenDeviceWeight(double oxygenDeviceWeight) {
            this.oxygenDeviceWeight = oxygenDeviceWeight;
        }

        public double getMobilityWeight() {
            return mobilityWeight;
        }

        public void setMobilityWeight(double mobilityWeight) {
            this.mobilityWeight = mobilityWeight;
        }

        public double getNoTransportationWeight() {
            return noTransportationWeight;
        }

        public void setNoTransportationWeight(double noTransportationWeight) {
            this.noTransportationWeight = noTransportationWeight;
        }

        public double getFinancialStrainWeight() {
            return financialStrainWeight;
        }

        public void setFinancialStrainWeight(double financialStrainWeight) {
            this.financialStrainWeight = financialStrainWeight;
        }
    }

    /** Centroid clustering parameters. */
    public static class KMeans {
        private int minClusters = 2;
        private int maxClusters = 6;
        private int maxIterations = 300;
        private long seed = 42;

        void validate(List<String> errors) {
            if (minClusters < 1) {
                errors.add("kmeans 'minClusters' must be >= 1");
            }
            if (maxClusters < minClusters) {
                errors.add("kmeans 'maxClusters' must be >= 'minClusters'");
            }
            if (maxIterations < 1) {
                errors.add("kmeans 'maxIterations' must be >= 1");
            }
        }

        public int getMinClusters() {
            return minClusters;
        }

        public void setMinClusters(int minClusters) {
            this.minClusters = minClusters;
        }

        public int getMaxClusters() {
            return maxClusters;
        }

        public void setMaxClusters(int maxClusters) {
            this.maxClusters = maxClusters;
        }

        public int getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }
    }

    /** Density clustering parameters. */
    public static class Dbscan {
        private double eps = 1.25;
        private int minSamplesDivisor = 20;
        private int minSamplesFloor = 3;
        private int minSamplesCap = 8;

        void validate(List<String> errors) {
            if (eps <= 0) {
                errors.add("dbscan 'eps' must be > 0");
            }
            if (minSamplesDivisor < 1) {
                errors.add("dbscan 'minSamplesDivisor' must be >= 1");
            }
            if (minSamplesFloor < 1) {
                errors.add("dbscan 'minSamplesFloor' must be >= 1");
            }
            if (minSamplesCap < minSamplesFloor) {
                errors.add("dbscan 'minSamplesCap' must be >= 'minSamplesFloor'");
            }
        }

        public double getEps() {
            return eps;
        }

        public void setEps(double eps) {
            this.eps = eps;
        }

        public int getMinSamplesDivisor() {
            return minSamplesDivisor;
        }

        public void setMinSamplesDivisor(int minSamplesDivisor) {
            this.minSamplesDivisor = minSamplesDivisor;
        }

        public int getMinSamplesFloor() {
            return minSamplesFloor;
        }

        public void setMinSamplesFloor(int minSamplesFloor) {
            this.minSamplesFloor = minSamplesFloor;
        }

        public int getMinSamplesCap() {
            return minSamplesCap;
        }

        public void setMinSamplesCap(int minSamplesCap) {
            this.minSamplesCap = minSamplesCap;
        }
    }

    /** Isolation forest parameters. */
    public static class IsolationForest {
        private int trees = 100;
        private int maxSamples = 256;
        private double contamination = 0.05;
        private long seed = 42;

        void validate(List<String> errors) {
            if (trees < 1) {
                errors.add("isolationForest 'trees' must be >= 1");
            }
            if (maxSamples < 2) {
                errors.add("isolationForest 'maxSamples' must be >= 2");
            }
            if (contamination <= 0 || contamination > 0.5) {
                errors.add("isolationForest 'contamination' must be in (0, 0.5]");
            }
        }

        public int getTrees() {
            return trees;
        }

        public void setTrees(int trees) {
            this.trees = trees;
        }

        public int getMaxSamples() {
            return maxSamples;
        }

        public void setMaxSamples(int maxSamples) {
            this.maxSamples = maxSamples;
        }

        public double getContamination() {
            return contamination;
        }

        public void setContamination(double contamination) {
            this.contamination = contamination;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }
    }

    /** Drift classification and projection parameters. */
    public static class Drift {
        private int windowDays = 30;
        private double acceleratingThreshold = 0.25;
        private double escalatingThreshold = 0.15;
        private double projectionFactor = 0.5;

        void validate(List<String> errors) {
            if (windowDays < 1) {
                errors.add("drift 'windowDays' must be >= 1");
            }
            if (acceleratingThreshold < escalatingThreshold) {
                errors.add("drift 'acceleratingThreshold' must be >= 'escalatingThreshold'");
            }
        }

        public int getWindowDays() {
            return windowDays;
        }

        public void setWindowDays(int windowDays) {
            this.windowDays = windowDays;
        }

        public double getAcceleratingThreshold() {
            return acceleratingThreshold;
        }

        public void setAcceleratingThreshold(double acceleratingThreshold) {
            this.acceleratingThreshold = acceleratingThreshold;
        }

        public double getEscalatingThreshold() {
            return escalatingThreshold;
        }

        public void setEscalatingThreshold(double escalatingThreshold) {
            this.escalatingThreshold = escalatingThreshold;
        }

        public double getProjectionFactor() {
            return projectionFactor;
        }

        public void setProjectionFactor(double projectionFactor) {
            this.projectionFactor = projectionFactor;
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public KMeans getKmeans() {
        return kmeans;
    }

    public void setKmeans(KMeans kmeans) {
        this.kmeans = kmeans;
    }

    public Dbscan getDbscan() {
        return dbscan;
    }

    public void setDbscan(Dbscan dbscan) {
        this.dbscan = dbscan;
    }

    public IsolationForest getIsolationForest() {
        return isolationForest;
    }

    public void setIsolationForest(IsolationForest isolationForest) {
        this.isolationForest = isolationForest;
    }

    public Drift getDrift() {
        return drift;
    }

    public void setDrift(Drift drift) {
        this.drift = drift;
    }

    @Override
    public String toString() {
        return "ModelConfig{modelName='" + modelName + "'"
                + ", kmeans=[" + kmeans.minClusters + ".." + kmeans.maxClusters + "]"
                + ", dbscanEps=" + dbscan.eps
                + ", contamination=" + isolationForest.contamination
                + ", driftWindowDays=" + drift.windowDays + '}';
    }
}

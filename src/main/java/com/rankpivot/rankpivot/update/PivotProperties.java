package com.rankpivot.rankpivot.update;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized pivot configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "pivot")
public class PivotProperties {

    private String dataRoot = PivotConstants.DEFAULT_DATA_ROOT;
    private String outputDir = PivotConstants.DEFAULT_OUTPUT_DIR;
    private String anchorCategory = PivotConstants.DEFAULT_ANCHOR_CATEGORY;
    private String cron = PivotConstants.DEFAULT_CRON;
    private String scheduledDecision = PivotConstants.DEFAULT_SCHEDULED_DECISION;

    public String getDataRoot() {
        return dataRoot;
    }

    public void setDataRoot(String dataRoot) {
        this.dataRoot = dataRoot;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getAnchorCategory() {
        return anchorCategory;
    }

    public void setAnchorCategory(String anchorCategory) {
        this.anchorCategory = anchorCategory;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public String getScheduledDecision() {
        return scheduledDecision;
    }

    public void setScheduledDecision(String scheduledDecision) {
        this.scheduledDecision = scheduledDecision;
    }
}

package com.pulsewatch.core.config;

import java.io.Serializable;

/**
 * Per-service override of the template merge threshold and cap.
 *
 * @since 1.0.0
 */
public class ServiceMiningOverride implements Serializable {

    private static final long serialVersionUID = 1L;

    private String service;
    private Double mergeThreshold;
    private Integer templateCap;

    public String getService() {
        return service;
    }

    public void setService(String service) {
        this.service = service;
    }

    public Double getMergeThreshold() {
        return mergeThreshold;
    }

    public void setMergeThreshold(Double mergeThreshold) {
        this.mergeThreshold = mergeThreshold;
    }

    public Integer getTemplateCap() {
        return templateCap;
    }

    public void setTemplateCap(Integer templateCap) {
        this.templateCap = templateCap;
    }
}

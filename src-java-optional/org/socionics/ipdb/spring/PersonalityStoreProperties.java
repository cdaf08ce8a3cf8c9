package org.socionics.ipdb.spring;

import java.util.List;

import org.socionics.ipdb.backend.BackendKind;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for {@link PersonalityStoreAutoConfiguration}.
 */
@ConfigurationProperties(prefix = "ipdb")
public class PersonalityStoreProperties {

    /**
     * Directory holding the database or snapshot files.
     */
    private String dataDir;

    /**
     * Native backends to probe, in order. The fallback store is always tried last.
     */
    private List<BackendKind> backends;

    private Integer dimensions;
    private Integer capacity;
    private Integer m;
    private Integer efConstruction;
    private Integer efSearch;
    private Integer exactSearchThreshold;

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public List<BackendKind> getBackends() {
        return backends;
    }

    public void setBackends(List<BackendKind> backends) {
        this.backends = backends;
    }

    public Integer getDimensions() {
        return dimensions;
    }

    public void setDimensions(Integer dimensions) {
        this.dimensions = dimensions;
    }

    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
    }

    public Integer getM() {
        return m;
    }

    public void setM(Integer m) {
        this.m = m;
    }

    public Integer getEfConstruction() {
        return efConstruction;
    }

    public void setEfConstruction(Integer efConstruction) {
        this.efConstruction = efConstruction;
    }

    public Integer getEfSearch() {
        return efSearch;
    }

    public void setEfSearch(Integer efSearch) {
        this.efSearch = efSearch;
    }

    public Integer getExactSearchThreshold() {
        return exactSearchThreshold;
    }

    public void setExactSearchThreshold(Integer exactSearchThreshold) {
        this.exactSearchThreshold = exactSearchThreshold;
    }
}

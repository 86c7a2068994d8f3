package com.comsect1.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Gate settings bound from {@code comsect1.gate.*}. Command-line options override
 * the extension lists for a single run.
 */
@Component
@ConfigurationProperties(prefix = "comsect1.gate")
public class GateProperties {

    private List<String> includeExtensions = List.of(".c", ".h", ".cpp", ".hpp");
    private List<String> headerExtensions = List.of(".h", ".hpp");
    private List<String> redFlagSourceExtensions = List.of(".c");
    private List<String> symbolExtensions = List.of(".vb", ".cs");
    private List<String> ignoredDirectories = List.of(".git", ".svn", ".idea", ".vscode", "node_modules");
    private int emptyIdeaThreshold = 10;
    private String coreContractHeader = "cfg_core.h";
    private String projectTargetHeader = "cfg_project.h";
    private String projectDatabaseHeader = "db_project.h";
    private boolean parallel = false;

    public List<String> getIncludeExtensions() { return includeExtensions; }
    public void setIncludeExtensions(List<String> includeExtensions) { this.includeExtensions = includeExtensions; }
    public List<String> getHeaderExtensions() { return headerExtensions; }
    public void setHeaderExtensions(List<String> headerExtensions) { this.headerExtensions = headerExtensions; }
    public List<String> getRedFlagSourceExtensions() { return redFlagSourceExtensions; }
    public void setRedFlagSourceExtensions(List<String> redFlagSourceExtensions) { this.redFlagSourceExtensions = redFlagSourceExtensions; }
    public List<String> getSymbolExtensions() { return symbolExtensions; }
    public void setSymbolExtensions(List<String> symbolExtensions) { this.symbolExtensions = symbolExtensions; }
    public List<String> getIgnoredDirectories() { return ignoredDirectories; }
    public void setIgnoredDirectories(List<String> ignoredDirectories) { this.ignoredDirectories = ignoredDirectories; }
    public int getEmptyIdeaThreshold() { return emptyIdeaThreshold; }
    public void setEmptyIdeaThreshold(int emptyIdeaThreshold) { this.emptyIdeaThreshold = emptyIdeaThreshold; }
    public String getCoreContractHeader() { return coreContractHeader; }
    public void setCoreContractHeader(String coreContractHeader) { this.coreContractHeader = coreContractHeader; }
    public String getProjectTargetHeader() { return projectTargetHeader; }
    public void setProjectTargetHeader(String projectTargetHeader) { this.projectTargetHeader = projectTargetHeader; }
    public String getProjectDatabaseHeader() { return projectDatabaseHeader; }
    public void setProjectDatabaseHeader(String projectDatabaseHeader) { this.projectDatabaseHeader = projectDatabaseHeader; }
    public boolean isParallel() { return parallel; }
    public void setParallel(boolean parallel) { this.parallel = parallel; }
}

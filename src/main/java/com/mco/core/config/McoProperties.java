package com.mco.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mco")
public class McoProperties {

    private State state = new State();
    private Workflow workflow = new Workflow();

    // -- State accessors (delegate to nested) --
    public String getStateBackend() { return state.backend; }
    public String getStateDirectory() { return state.directory; }
    public String getJdbcUrl() { return state.jdbc.url; }
    public String getJdbcUsername() { return state.jdbc.username; }
    public String getJdbcPassword() { return state.jdbc.password; }
    public String getJdbcTable() { return state.jdbc.table; }

    // -- Workflow accessors (delegate to nested) --
    public boolean isWorkflowCacheEnabled() { return workflow.cacheEnabled; }

    public State getState() { return state; }
    public void setState(State state) { this.state = state; }
    public Workflow getWorkflow() { return workflow; }
    public void setWorkflow(Workflow workflow) { this.workflow = workflow; }

    public static class State {
        /** memory, file or jdbc. */
        private String backend = "memory";
        /** Directory holding one JSON document per orchestration (file backend). */
        private String directory = ".mco/state";
        private Jdbc jdbc = new Jdbc();

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public Jdbc getJdbc() { return jdbc; }
        public void setJdbc(Jdbc jdbc) { this.jdbc = jdbc; }
    }

    public static class Jdbc {
        private String url = "jdbc:postgresql://localhost:5432/mco";
        private String username = "mco";
        private String password = "";
        private String table = "mco_orchestrations";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public String getTable() { return table; }
        public void setTable(String table) { this.table = table; }
    }

    public static class Workflow {
        /** Reuse the parsed config when the same directory is started again. */
        private boolean cacheEnabled = true;

        public boolean isCacheEnabled() { return cacheEnabled; }
        public void setCacheEnabled(boolean cacheEnabled) { this.cacheEnabled = cacheEnabled; }
    }
}

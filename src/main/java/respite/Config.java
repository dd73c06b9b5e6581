package respite;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import respite.utils.Log;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final String DEFAULT_FILE = "respite.yaml";
    public static final String ENV_PREFIX = "RESPITE_";

    public String version = "1.0.0";
    public String bind = "127.0.0.1";
    public int port = 6379;
    public int maxConnections = 1000;
    public int bufferSize = 1024;
    public int idleTimeoutSeconds = 300;
    public int workerThreads = 0; // 0 = Netty default
    public long maxMemory = 1024L * 1024 * 1024; // 1GB, 0 = unlimited
    public boolean persistenceEnabled = false;
    public String snapshotFile = "respite-dump.json";
    public String logLevel = "INFO";

    public Config() {
        // Default constructor for Jackson
    }

    // Accepts both 1073741824 and "1GB" in YAML
    @JsonSetter("maxMemory")
    public void setMaxMemory(String val) {
        this.maxMemory = parseMemory(val);
    }

    public static Config load(String filename) {
        return load(filename, System.getenv());
    }

    public static Config load(String filename, Map<String, String> env) {
        File f = new File(filename);
        if (!f.exists()) {
            // Try looking for .yaml extension if .conf was passed
            if (filename.endsWith(".conf")) {
                File yamlFile = new File(filename.replace(".conf", ".yaml"));
                if (yamlFile.exists()) f = yamlFile;
            }
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
                Config parsed = mapper.readValue(f, Config.class);
                if (parsed != null) config = parsed; // empty document
            } catch (Exception e) {
                Log.warn("Failed to load config as YAML (" + e.getMessage() + "). Attempting legacy parse...");
                config = loadLegacy(f, new Config());
            }
        }

        config.applyEnv(env);
        config.validate();
        return config;
    }

    private static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(f), StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                if (parts.length < 2) continue;
                config.set(parts[0], parts[1]);
            }
            Log.info("Loaded legacy config.");
        } catch (IOException | IllegalArgumentException e) {
            Log.error("Error loading legacy config: " + e.getMessage() + ". Using defaults.");
            return new Config();
        }
        return config;
    }

    void applyEnv(Map<String, String> env) {
        for (Map.Entry<String, String> e : env.entrySet()) {
            if (!e.getKey().startsWith(ENV_PREFIX)) continue;
            String key = e.getKey().substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT).replace('_', '-');
            set(key, e.getValue());
        }
    }

    /**
     * Applies one setting by its redis.conf-style name (e.g. {@code max-connections} or
     * {@code maxmemory}). Unknown names are ignored.
     *
     * @throws IllegalArgumentException if the value does not parse
     */
    void set(String key, String val) {
        val = val.trim();
        try {
            switch (key.toLowerCase(Locale.ROOT).replace("_", "-")) {
                case "version": version = val; break;
                case "bind": bind = val; break;
                case "port": port = Integer.parseInt(val); break;
                case "maxclients":
                case "max-connections": maxConnections = Integer.parseInt(val); break;
                case "buffer-size": bufferSize = Integer.parseInt(val); break;
                case "timeout":
                case "idle-timeout-seconds": idleTimeoutSeconds = Integer.parseInt(val); break;
                case "worker-threads": workerThreads = Integer.parseInt(val); break;
                case "maxmemory":
                case "max-memory": maxMemory = parseMemory(val); break;
                case "persistence-enabled": persistenceEnabled = parseBoolean(val); break;
                case "dbfilename":
                case "snapshot-file": snapshotFile = val; break;
                case "loglevel":
                case "log-level": logLevel = val; break;
                default: break;
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + val, e);
        }
    }

    void validate() {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (maxConnections < 1) throw new IllegalArgumentException("maxConnections must be positive");
        if (bufferSize < 64) throw new IllegalArgumentException("bufferSize must be at least 64 bytes");
        if (idleTimeoutSeconds < 0) throw new IllegalArgumentException("idleTimeoutSeconds cannot be negative");
        if (workerThreads < 0) throw new IllegalArgumentException("workerThreads cannot be negative");
    }

    private static boolean parseBoolean(String val) {
        switch (val.toLowerCase(Locale.ROOT)) {
            case "true": case "yes": case "1": return true;
            case "false": case "no": case "0": return false;
            default: throw new IllegalArgumentException("not a boolean: " + val);
        }
    }

    public static long parseMemory(String val) {
        String v = val.trim().toUpperCase(Locale.ROOT);
        long factor = 1;
        if (v.endsWith("GB")) { factor = 1024*1024*1024L; v = v.substring(0, v.length() - 2); }
        else if (v.endsWith("MB")) { factor = 1024*1024L; v = v.substring(0, v.length() - 2); }
        else if (v.endsWith("KB")) { factor = 1024L; v = v.substring(0, v.length() - 2); }
        else if (v.endsWith("B")) { v = v.substring(0, v.length() - 1); }
        return Long.parseLong(v.trim()) * factor;
    }
}

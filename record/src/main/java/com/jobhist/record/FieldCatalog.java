package com.jobhist.record;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The closed table of known record fields and their kinds.
 *
 * <p>Fields are looked up by query name (e.g. {@code numcpus}) or by the key
 * they are logged under (e.g. {@code Resource_List.ncpus}). Lookups are
 * case-sensitive and constant time. Keys that appear in a log but are not in
 * the catalog are still kept on records, as text, under their logged key.</p>
 *
 * <p>{@link #pbs()} returns the PBS Pro accounting catalog. Custom catalogs
 * can be assembled with {@link #builder()}.</p>
 */
public final class FieldCatalog {

    public static final String RECORD_TYPE = "record_type";
    public static final String TIMESTAMP = "timestamp";
    public static final String ID = "id";
    public static final String SHORT_ID = "short_id";
    public static final String MESSAGE = "message";

    private static final FieldCatalog PBS = createPbs();

    private final Map<String, FieldDefinition> byName;
    private final Map<String, FieldDefinition> byLogKey;

    private FieldCatalog(Builder builder) {
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.byName));
        Map<String, FieldDefinition> keys = new HashMap<>();
        for (FieldDefinition def : byName.values()) {
            if (def.logKey() != null) {
                keys.put(def.logKey(), def);
            }
        }
        this.byLogKey = Collections.unmodifiableMap(keys);
    }

    /**
     * The PBS Pro accounting log catalog.
     */
    public static FieldCatalog pbs() {
        return PBS;
    }

    /**
     * Find a field by query name, falling back to its logged key.
     *
     * @return the definition, or {@code null} if unknown
     */
    public FieldDefinition find(String nameOrKey) {
        FieldDefinition def = byName.get(nameOrKey);
        return def != null ? def : byLogKey.get(nameOrKey);
    }

    /**
     * Find a field by query name or logged key.
     *
     * @throws UnknownFieldException if the catalog has no such field
     */
    public FieldDefinition require(String nameOrKey) {
        FieldDefinition def = find(nameOrKey);
        if (def == null) {
            throw new UnknownFieldException(nameOrKey);
        }
        return def;
    }

    /**
     * Find a field by the key it is logged under.
     *
     * @return the definition, or {@code null} if the key is not catalogued
     */
    public FieldDefinition byLogKey(String logKey) {
        return byLogKey.get(logKey);
    }

    /**
     * All definitions, in catalog order.
     */
    public Collection<FieldDefinition> definitions() {
        return byName.values();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, FieldDefinition> byName = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(FieldDefinition definition) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate field: " + definition.name());
            }
            return this;
        }

        public Builder header(String name, FieldKind kind, String header, String label, int width) {
            return add(new FieldDefinition(name, null, kind, header, label, width));
        }

        public Builder field(String name, String logKey, FieldKind kind, String header, String label, int width) {
            return add(new FieldDefinition(name, logKey, kind, header, label, width));
        }

        public FieldCatalog build() {
            return new FieldCatalog(this);
        }
    }

    private static FieldCatalog createPbs() {
        return builder()
                // Line header
                .header(ID, FieldKind.TEXT, "Job ID", "Job ID", 20)
                .header(SHORT_ID, FieldKind.TEXT, "Job ID", "Short Job ID", 10)
                .header(RECORD_TYPE, FieldKind.TEXT, "Type", "Record Type", 4)
                .header(TIMESTAMP, FieldKind.TIMESTAMP, "Logged", "Log Time", 19)
                // Ownership and placement
                .field("user", "user", FieldKind.TEXT, "User", "User", 10)
                .field("group", "group", FieldKind.TEXT, "Group", "Group", 10)
                .field("account", "account", FieldKind.TEXT, "Account", "Account", 10)
                .field("project", "project", FieldKind.TEXT, "Project", "Project", 10)
                .field("queue", "queue", FieldKind.TEXT, "Queue", "Queue", 8)
                .field("jobname", "jobname", FieldKind.TEXT, "Job Name", "Job Name", 16)
                .field("exec_host", "exec_host", FieldKind.TEXT, "Hosts", "Execution Hosts", 16)
                .field("exec_vnode", "exec_vnode", FieldKind.TEXT, "Vnodes", "Execution Vnodes", 16)
                .field("select", "Resource_List.select", FieldKind.TEXT, "Select", "Select Statement", 16)
                .field(MESSAGE, MESSAGE, FieldKind.TEXT, "Message", "Message", 20)
                // Requested resources
                .field("numnodes", "Resource_List.nodect", FieldKind.INTEGER, "Nodes", "Node Count", 5)
                .field("numcpus", "Resource_List.ncpus", FieldKind.INTEGER, "CPUs", "CPU Count", 6)
                .field("numgpus", "Resource_List.ngpus", FieldKind.INTEGER, "GPUs", "GPU Count", 4)
                .field("mpiprocs", "Resource_List.mpiprocs", FieldKind.INTEGER, "MPI", "MPI Ranks", 5)
                .field("reqmem", "Resource_List.mem", FieldKind.MEMORY, "ReqMem", "Requested Memory (GB)", 8)
                .field("walltime", "Resource_List.walltime", FieldKind.DURATION, "ReqTime", "Requested Walltime", 8)
                // Used resources
                .field("cputime", "resources_used.cput", FieldKind.DURATION, "CPUTime", "CPU Time", 9)
                .field("elapsed", "resources_used.walltime", FieldKind.DURATION, "Elapsed", "Elapsed Walltime", 8)
                .field("memory", "resources_used.mem", FieldKind.MEMORY, "Mem(GB)", "Used Memory (GB)", 8)
                .field("vmemory", "resources_used.vmem", FieldKind.MEMORY, "VMem(GB)", "Used Virtual Memory (GB)", 8)
                .field("cpupercent", "resources_used.cpupercent", FieldKind.INTEGER, "CPU%", "CPU Percent", 6)
                .field("avgcpu", "resources_used.avgcpuload", FieldKind.FLOAT, "AvgCPU", "Average CPU Load", 7)
                // Outcome
                .field("status", "Exit_status", FieldKind.INTEGER, "Exit", "Exit Status", 5)
                .field("runcount", "run_count", FieldKind.INTEGER, "Runs", "Run Count", 4)
                .field("session", "session", FieldKind.INTEGER, "Session", "Session ID", 8)
                // Lifecycle times (epoch seconds in the log)
                .field("submit", "ctime", FieldKind.TIMESTAMP, "Submit", "Submission Time", 19)
                .field("queued", "qtime", FieldKind.TIMESTAMP, "Queued", "Queue Time", 19)
                .field("eligible", "etime", FieldKind.TIMESTAMP, "Eligible", "Eligible Time", 19)
                .field("start", "start", FieldKind.TIMESTAMP, "Start", "Start Time", 19)
                .field("end", "end", FieldKind.TIMESTAMP, "End", "End Time", 19)
                .build();
    }
}

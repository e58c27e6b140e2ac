package com.example.embeddingindex;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    @Autowired
    private EmbeddingStore store;

    @Autowired
    private VectorIndex vectorIndex;

    @Autowired
    private SnapshotManager snapshots;

    @Autowired
    private SnapshotScheduler scheduler;

    @Autowired
    private ConcurrencyGate gate;

    @PostMapping("/index/rebuild")
    public Map<String, Object> rebuild() {
        int n = store.rebuildFromLedger();
        return java.util.Collections.singletonMap("indexed", n);
    }

    @GetMapping("/index/status")
    public Map<String, Object> status() {
        StoreStats stats = store.stats();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("projects", stats.getProjects());
        out.put("items", stats.getItems());
        out.put("ledger_rows", stats.getLedgerRows());
        out.put("index_size", stats.getIndexSize());
        out.put("dimension", stats.getDimension());
        if (vectorIndex instanceof HnswVectorIndex) {
            out.put("params", ((HnswVectorIndex) vectorIndex).getHnswParams());
        } else {
            out.put("params", java.util.Collections.singletonMap("implementation", "brute-force"));
        }
        return out;
    }

    @PostMapping("/index/snapshot")
    public Map<String, Object> snapshotNow() {
        snapshots.backupToRemote();
        return snapshotInfo();
    }

    @GetMapping("/index/snapshot")
    public Map<String, Object> snapshotInfo() {
        Map<String, Object> out = new LinkedHashMap<>(snapshots.info());
        out.put("scheduler", scheduler.info());
        return out;
    }

    @GetMapping("/gates")
    public Map<String, Map<String, Integer>> gates() {
        return gate.snapshot();
    }
}

package com.example.kvdriver.mcp;

import com.example.kvdriver.driver.RemoteDriver;
import com.example.kvdriver.driver.Row;
import com.example.kvdriver.driver.RowLookup;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class DriverTools {

    private static final int MAX_ROWS = 1000;

    private final RemoteDriver driver;

    public DriverTools(RemoteDriver driver) {
        this.driver = driver;
    }

    @Tool(description = "Get the value stored under a key")
    public Map<String, Object> kv_get(@ToolParam(required = false, description = "Table name, default 'json'") String table,
                                      String key) {
        RowLookup lookup = driver.getRowByKey(tableOrDefault(table), key);
        Map<String, Object> result = new HashMap<>();
        result.put("key", key);
        result.put("found", lookup.isFound());
        result.put("value", lookup.getValue());
        return result;
    }

    @Tool(description = "Set a key to a value, replacing any previous value, with an optional ttlSec")
    public Map<String, Object> kv_set(@ToolParam(required = false, description = "Table name, default 'json'") String table,
                                      String key,
                                      @ToolParam(required = false) Object value,
                                      @ToolParam(required = false, description = "Seconds until the entry expires") Integer ttlSec) {
        Instant expireAt = (ttlSec == null || ttlSec <= 0) ? null : Instant.now().plusSeconds(ttlSec);
        Object stored = driver.setRowByKey(tableOrDefault(table), key, value, false, expireAt);
        Map<String, Object> result = new HashMap<>();
        result.put("ok", true);
        result.put("value", stored);
        result.put("expireAt", expireAt == null ? null : expireAt.toString());
        return result;
    }

    @Tool(description = "Delete a key")
    public Map<String, Object> kv_del(@ToolParam(required = false, description = "Table name, default 'json'") String table,
                                      String key) {
        return Map.of("ok", true, "deleted", driver.deleteRowByKey(tableOrDefault(table), key));
    }

    @Tool(description = "List entries whose key starts with a prefix (limit enforced)")
    public Map<String, Object> kv_scan(@ToolParam(required = false, description = "Table name, default 'json'") String table,
                                       String prefix,
                                       @ToolParam(required = false) Integer limit) {
        return rowsResult(driver.getStartsWith(tableOrDefault(table), prefix), limit);
    }

    @Tool(description = "List every entry of a table (limit enforced)")
    public Map<String, Object> kv_list(@ToolParam(required = false, description = "Table name, default 'json'") String table,
                                       @ToolParam(required = false) Integer limit) {
        return rowsResult(driver.getAllRows(tableOrDefault(table)), limit);
    }

    @Tool(description = "Delete every entry of a table")
    public Map<String, Object> kv_clear(@ToolParam(required = false, description = "Table name, default 'json'") String table) {
        return Map.of("ok", true, "deleted", driver.deleteAllRows(tableOrDefault(table)));
    }

    private static String tableOrDefault(String table) {
        return (table == null || table.isBlank()) ? RemoteDriver.DEFAULT_TABLE : table;
    }

    private static Map<String, Object> rowsResult(List<Row> rows, Integer limit) {
        int lim = (limit == null || limit <= 0) ? 100 : Math.min(limit, MAX_ROWS);
        Map<String, Object> entries = new LinkedHashMap<>();
        for (Row row : rows) {
            if (entries.size() >= lim) {
                break;
            }
            entries.put(row.getId(), row.getValue());
        }
        Map<String, Object> result = new HashMap<>();
        result.put("entries", entries);
        result.put("count", entries.size());
        result.put("truncated", rows.size() > entries.size());
        return result;
    }
}

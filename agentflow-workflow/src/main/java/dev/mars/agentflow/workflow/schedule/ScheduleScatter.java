/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.agentflow.workflow.schedule;

import dev.mars.agentflow.workflow.parser.YamlSupport;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Replaces fuzzy schedules ({@code daily}, {@code hourly}, {@code weekly},
 * {@code daily on weekdays}) with concrete cron expressions.
 *
 * <p>The minute, hour and weekday are derived from an FNV-1a hash of the
 * workflow identifier, so many workflows declaring {@code daily} do not all run
 * at the same moment, while each one compiles to the same cron every time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public final class ScheduleScatter {

    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private final long hash;

    public ScheduleScatter(String workflowIdentifier) {
        this.hash = fnv1a(Objects.requireNonNull(workflowIdentifier, "Workflow identifier cannot be null"));
    }

    /**
     * 32-bit FNV-1a over the UTF-8 bytes, as an unsigned value.
     */
    static long fnv1a(String text) {
        int hash = FNV_OFFSET_BASIS;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return Integer.toUnsignedLong(hash);
    }

    /**
     * @return the cron expression for a fuzzy schedule, or the input unchanged
     */
    public String scatter(String cron) {
        int minute = (int) (hash % 60);
        int hour = (int) ((hash / 60) % 24);
        int weekday = (int) ((hash / 1440) % 7);
        switch (cron.trim().toLowerCase(Locale.ROOT)) {
            case "hourly":
                return minute + " * * * *";
            case "daily":
                return minute + " " + hour + " * * *";
            case "daily on weekdays":
                return minute + " " + hour + " * * 1-5";
            case "weekly":
                return minute + " " + hour + " * * " + weekday;
            default:
                return cron;
        }
    }

    /**
     * Rewrites the {@code schedule} entry of a trigger section. A plain string
     * schedule becomes a one-entry list.
     *
     * @return a new trigger value; other triggers are untouched
     */
    public Object apply(Object on) {
        Map<String, Object> triggers = YamlSupport.asMap(on);
        if (triggers == null || !triggers.containsKey("schedule")) {
            return on;
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : triggers.entrySet()) {
            if (!"schedule".equals(entry.getKey())) {
                result.put(entry.getKey(), YamlSupport.mutableCopy(entry.getValue()));
                continue;
            }
            List<Object> schedules = new ArrayList<>();
            Object value = entry.getValue();
            if (value instanceof String) {
                schedules.add(cronEntry(scatter((String) value)));
            } else if (value instanceof List) {
                for (Object item : YamlSupport.asList(value)) {
                    Map<String, Object> schedule = YamlSupport.asMap(item);
                    if (schedule != null && schedule.get("cron") instanceof String) {
                        Map<String, Object> copy = new LinkedHashMap<>(schedule);
                        copy.put("cron", scatter((String) schedule.get("cron")));
                        schedules.add(copy);
                    } else {
                        schedules.add(YamlSupport.mutableCopy(item));
                    }
                }
            } else {
                result.put(entry.getKey(), YamlSupport.mutableCopy(value));
                continue;
            }
            result.put(entry.getKey(), schedules);
        }
        return result;
    }

    private static Map<String, Object> cronEntry(String cron) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("cron", cron);
        return entry;
    }
}

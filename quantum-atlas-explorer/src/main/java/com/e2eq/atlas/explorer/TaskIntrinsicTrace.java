package com.e2eq.atlas.explorer;

import com.e2eq.atlas.core.EntityRecord;

import java.util.*;

/**
 * Task to capability to intrinsic chain.
 *
 * @param task                    the traced task
 * @param capabilities            capabilities the task requires directly
 * @param intrinsicsByCapability  capability id to the intrinsics and adapters reached through it;
 *                                every capability has an entry, possibly empty
 * @param allIntrinsics           every intrinsic and adapter reached, in discovery order
 */
public record TaskIntrinsicTrace(EntityRecord task,
                                 List<EntityRecord> capabilities,
                                 Map<String, List<EntityRecord>> intrinsicsByCapability,
                                 List<EntityRecord> allIntrinsics) {

    public TaskIntrinsicTrace {
        Objects.requireNonNull(task, "task");
        capabilities = List.copyOf(capabilities);
        Map<String, List<EntityRecord>> grouped = new LinkedHashMap<>();
        intrinsicsByCapability.forEach((k, v) -> grouped.put(k, List.copyOf(v)));
        intrinsicsByCapability = Collections.unmodifiableMap(grouped);
        allIntrinsics = List.copyOf(allIntrinsics);
    }
}

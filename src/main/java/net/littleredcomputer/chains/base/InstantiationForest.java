// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All instantiation families produced for one QA sample, plus the id to data map they
 * refer into.
 */
public final class InstantiationForest {
    private final List<InstantiationFamily> families = new ArrayList<>();
    private final Map<String, InstantiationData> dataMap = new LinkedHashMap<>();

    public InstantiationFamily addFamily(RelationalTree tree) {
        InstantiationFamily f = new InstantiationFamily(tree);
        families.add(f);
        return f;
    }

    /**
     * Records the data and lists it under the family.
     * @throws IllegalArgumentException if the data has no identifier or a duplicate one
     */
    public void addData(InstantiationFamily family, InstantiationData data) {
        String id = data.identifier();
        if (id == null) throw new IllegalArgumentException("instantiation data needs an identifier");
        if (dataMap.containsKey(id)) throw new IllegalArgumentException("duplicate instantiation id: " + id);
        dataMap.put(id, data);
        family.add(id);
    }

    public List<InstantiationFamily> families() { return Collections.unmodifiableList(families); }
    public Map<String, InstantiationData> dataMap() { return Collections.unmodifiableMap(dataMap); }

    public ImmutableMap<String, InstantiationData> familyData(InstantiationFamily family) {
        ImmutableMap.Builder<String, InstantiationData> b = ImmutableMap.builder();
        for (String id : family.dataIds()) b.put(id, dataMap.get(id));
        return b.build();
    }

    public boolean isEmpty() { return families.isEmpty(); }
}

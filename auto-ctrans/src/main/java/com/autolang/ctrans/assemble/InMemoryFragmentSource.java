package com.autolang.ctrans.assemble;

import com.autolang.tree.module.Fragment;
import com.autolang.tree.module.Scenario;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内存中的片段来源（嵌入调用与测试）。
 */
public class InMemoryFragmentSource implements FragmentSource {
    private final Map<String, Fragment> fragments = new LinkedHashMap<>();

    public InMemoryFragmentSource add(Fragment fragment) {
        fragments.put(key(fragment.getModuleName(), fragment.getScenario()), fragment);
        return this;
    }

    @Override
    public Fragment load(String moduleName, Scenario scenario) {
        return fragments.get(key(moduleName, scenario));
    }

    private static String key(String moduleName, Scenario scenario) {
        return scenario != null ? moduleName + "." + scenario.getSuffix() : moduleName;
    }
}

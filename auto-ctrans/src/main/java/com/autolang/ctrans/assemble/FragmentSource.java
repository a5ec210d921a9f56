package com.autolang.ctrans.assemble;

import com.autolang.tree.module.Fragment;
import com.autolang.tree.module.Scenario;

import java.io.IOException;

/**
 * 片段来源。
 */
public interface FragmentSource {

    /**
     * 加载模块的一个片段。
     *
     * @param moduleName 模块名
     * @param scenario   场景；null 表示共享接口片段
     * @return 片段，不存在时返回 null
     */
    Fragment load(String moduleName, Scenario scenario) throws IOException;
}

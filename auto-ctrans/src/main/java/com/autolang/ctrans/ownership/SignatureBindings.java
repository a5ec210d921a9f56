package com.autolang.ctrans.ownership;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个具体函数或方法的全部绑定：接收者（静态方法与自由函数为 null）、参数、返回槽。
 */
public final class SignatureBindings {
    private final ParamBinding receiver;
    private final List<ParamBinding> params;
    private final ParamBinding returnSlot;

    public SignatureBindings(ParamBinding receiver, List<ParamBinding> params, ParamBinding returnSlot) {
        this.receiver = receiver;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.returnSlot = returnSlot;
    }

    public ParamBinding getReceiver() {
        return receiver;
    }

    public List<ParamBinding> getParams() {
        return params;
    }

    public ParamBinding getParam(int index) {
        return index < params.size() ? params.get(index) : null;
    }

    public ParamBinding getReturnSlot() {
        return returnSlot;
    }
}

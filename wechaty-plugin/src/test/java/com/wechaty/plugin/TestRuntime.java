package com.wechaty.plugin;

import com.wechaty.plugin.runtime.WechatyRuntime;
import com.wechaty.puppet.Puppet;

public record TestRuntime(String name, Puppet puppet) implements WechatyRuntime {

    public TestRuntime() {
        this("test-bot", new StubPuppet());
    }
}

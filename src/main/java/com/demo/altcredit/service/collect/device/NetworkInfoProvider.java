package com.demo.altcredit.service.collect.device;

public interface NetworkInfoProvider {
    NetworkSnapshot current();
}

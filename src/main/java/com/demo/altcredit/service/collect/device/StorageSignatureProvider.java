package com.demo.altcredit.service.collect.device;

import java.util.Set;

/** Local storage keys and cookie text, used only for signature matching. */
public interface StorageSignatureProvider {

    Set<String> storageKeys();

    String cookies();
}

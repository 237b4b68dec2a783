package org.pragmatica.triple.serialization.fury;

import org.apache.fury.Fury;
import org.apache.fury.ThreadSafeFury;
import org.apache.fury.config.Language;
import org.pragmatica.triple.serialization.ClassRegistrator;

public sealed interface FuryFactory {

    /**
     * Thread-safe Fury pool. Only registered classes, plus the JDK types Fury registers itself,
     * can be written or read. Peers must register the same classes in the same order.
     */
    static ThreadSafeFury fury(ClassRegistrator... registrators) {
        int coreCount = Runtime.getRuntime().availableProcessors();
        var fury = Fury.builder()
                       .withLanguage(Language.JAVA)
                       .withCodegen(false)
                       .requireClassRegistration(true)
                       .buildThreadSafeFuryPool(coreCount, coreCount * 2);

        for (var registrator : registrators) {
            registrator.registerClasses(fury::register);
        }

        return fury;
    }

    @SuppressWarnings("unused")
    record unused() implements FuryFactory {}
}

package com.libragraph.backup.core.config;

import com.libragraph.backup.util.DateProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

@ApplicationScoped
public class DateProviderProducer {

    @Produces
    @Singleton
    public DateProvider dateProvider() {
        return DateProvider.system();
    }
}

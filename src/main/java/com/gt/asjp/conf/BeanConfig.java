package com.gt.asjp.conf;

import com.gt.asjp.wordlist.AsjpDatabaseLoader;
import com.gt.asjp.wordlist.WordListRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;

@Configuration
public class BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(BeanConfig.class);

    @Bean
    public AsjpDatabaseLoader getAsjpDatabaseLoader() {
        return new AsjpDatabaseLoader();
    }

    @Bean
    public WordListRegistry getWordListRegistry(AsjpDatabaseLoader asjpDatabaseLoader,
                                                ResourceLoader resourceLoader,
                                                @Value("${asjp.database.location:file:asjp.tab}") String databaseLocation) throws IOException {
        WordListRegistry registry = WordListRegistry.of(asjpDatabaseLoader.load(resourceLoader.getResource(databaseLocation)));

        log.info("Registered word lists for {} languages from {}", registry.size(), databaseLocation);
        return registry;
    }
}

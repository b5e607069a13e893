package com.scholar;

import com.scholar.cache.QueryCacheProperties;
import com.scholar.classify.ClassifierProperties;
import com.scholar.corpus.CorpusProperties;
import com.scholar.search.SearchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
    CorpusProperties.class,
    SearchProperties.class,
    QueryCacheProperties.class,
    ClassifierProperties.class
})
public class ScholarServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScholarServiceApplication.class, args);
    }
}

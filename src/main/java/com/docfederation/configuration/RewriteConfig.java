package com.docfederation.configuration;

import com.docfederation.rewrite.LinkRewriter;
import com.docfederation.rewrite.NavigationBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

@Configuration
public class RewriteConfig {

    @Bean
    public LinkRewriter linkRewriter(AppProperties appProperties) {
        return new LinkRewriter(Set.copyOf(appProperties.getSite().getDocExtensions()));
    }

    @Bean
    public NavigationBuilder navigationBuilder(LinkRewriter linkRewriter) {
        return new NavigationBuilder(linkRewriter);
    }
}

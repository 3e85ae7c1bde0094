package com.keystone.core.config;

import com.keystone.core.document.ManagedDocumentMerger;
import com.keystone.core.document.RegionMarkers;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class KeystoneConfig {

    @Bean
    public ManagedDocumentMerger managedDocumentMerger(KeystoneProperties properties) {
        return new ManagedDocumentMerger(new RegionMarkers(properties.getMarkerNamespace()));
    }
}

package com.flamingo.ai.docqa.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import org.apache.hc.core5.http.HttpHost;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch client for the native vector backend (ES 9.0+, Apache HttpComponents 5). Only
 * created when {@code rag.vector.native-enabled} is true.
 */
@Configuration
@ConditionalOnProperty(prefix = "rag.vector", name = "native-enabled", havingValue = "true")
public class ElasticsearchConfig {

  @Bean(destroyMethod = "close")
  public Rest5Client vectorRestClient(
      @Value("${elasticsearch.scheme:http}") String scheme,
      @Value("${elasticsearch.host:localhost}") String host,
      @Value("${elasticsearch.port:9200}") int port) {
    return Rest5Client.builder(new HttpHost(scheme, host, port)).build();
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(Rest5Client vectorRestClient) {
    ElasticsearchTransport transport =
        new Rest5ClientTransport(vectorRestClient, new JacksonJsonpMapper());
    return new ElasticsearchClient(transport);
  }
}

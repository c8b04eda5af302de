/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.scoreboard.app.config;

import io.lettuce.core.ReadFrom;
import io.lettuce.core.cluster.ClusterClientOptions;
import io.lettuce.core.cluster.ClusterTopologyRefreshOptions;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

/**
 * Cluster mode connection. All job bookkeeping keys share one hash tag, so the job scripts
 * always run against a single slot.
 */
@ConditionalOnProperty(prefix = "spring", name = "redis.cluster.nodes")
@Configuration
public class RedisConfig {

  private final RedisProperties redisProperties;

  @Value("${scoreboard.redis.max-redirects:3}")
  private int maxRedirects;

  @Value("${scoreboard.redis.topology-refresh:5s}")
  private Duration topologyRefresh;

  public RedisConfig(RedisProperties redisProperties) {
    this.redisProperties = redisProperties;
  }

  @Bean
  public LettuceConnectionFactory redisConnectionFactory() {
    RedisClusterConfiguration clusterConfiguration =
        new RedisClusterConfiguration(redisProperties.getCluster().getNodes());
    clusterConfiguration.setMaxRedirects(maxRedirects);
    clusterConfiguration.setPassword(redisProperties.getPassword());

    // refresh the topology when a primary fails over
    ClusterTopologyRefreshOptions topologyRefreshOptions = ClusterTopologyRefreshOptions.builder()
        .enablePeriodicRefresh(topologyRefresh)
        .enableAllAdaptiveRefreshTriggers()
        .build();

    ClusterClientOptions clientOptions = ClusterClientOptions.builder()
        .topologyRefreshOptions(topologyRefreshOptions)
        .build();
    // job state is read back right after it is written, so replicas are not consulted
    LettuceClientConfiguration clientConfiguration = LettuceClientConfiguration.builder()
        .readFrom(ReadFrom.UPSTREAM)
        .clientOptions(clientOptions)
        .build();
    return new LettuceConnectionFactory(clusterConfiguration, clientConfiguration);
  }
}

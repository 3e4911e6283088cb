package io.github.themoah.kreg.kafka;

import io.github.themoah.kreg.model.PartitionInfo;
import io.vertx.core.Future;
import io.vertx.kafka.admin.KafkaAdminClient;
import io.vertx.kafka.admin.ListOffsetsResultInfo;
import io.vertx.kafka.admin.OffsetSpec;
import io.vertx.kafka.admin.TopicDescription;
import io.vertx.kafka.client.common.TopicPartition;
import io.vertx.kafka.client.common.TopicPartitionInfo;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of MetadataService using Vert.x KafkaAdminClient.
 */
public class AdminMetadataService implements MetadataService {

  private static final Logger log = LoggerFactory.getLogger(AdminMetadataService.class);

  private static final long CLOSE_TIMEOUT_MS = 2_000L;

  private final String brokerName;
  private final KafkaAdminClient adminClient;

  public AdminMetadataService(String brokerName, KafkaAdminClient adminClient) {
    this.brokerName = Objects.requireNonNull(brokerName, "brokerName cannot be null");
    this.adminClient = Objects.requireNonNull(adminClient, "adminClient cannot be null");
  }

  @Override
  public Future<List<PartitionInfo>> listPartitions(String topic) {
    Objects.requireNonNull(topic, "topic cannot be null");
    log.debug("[{}] Listing partitions for topic: {}", brokerName, topic);

    return adminClient.describeTopics(Collections.singletonList(topic))
      .map(descriptions -> {
        TopicDescription description = descriptions.get(topic);
        if (description == null) {
          throw new IllegalArgumentException("Topic not found: " + topic);
        }
        List<PartitionInfo> partitions = description.getPartitions().stream()
          .map(partition -> toPartitionInfo(topic, partition))
          .sorted(Comparator.comparingInt(PartitionInfo::partition))
          .collect(Collectors.toList());
        log.debug("[{}] Topic {} has {} partitions", brokerName, topic, partitions.size());
        return partitions;
      })
      .onFailure(err -> log.error("[{}] Failed to list partitions for topic: {}", brokerName, topic, err));
  }

  @Override
  public Future<Long> newestOffset(String topic, int partition) {
    Objects.requireNonNull(topic, "topic cannot be null");
    TopicPartition tp = new TopicPartition(topic, partition);

    return adminClient.listOffsets(Map.of(tp, OffsetSpec.LATEST))
      .map(offsets -> {
        ListOffsetsResultInfo info = offsets.get(tp);
        if (info == null) {
          throw new IllegalStateException("No offset returned for " + topic + "-" + partition);
        }
        log.debug("[{}] Topic {} partition {}: newest offset={}",
          brokerName, topic, partition, info.getOffset());
        return info.getOffset();
      });
  }

  @Override
  public Future<String> describeCluster() {
    log.debug("[{}] Describing cluster", brokerName);
    return adminClient.describeCluster()
      .map(description -> description.getClusterId())
      .onSuccess(clusterId -> log.debug("[{}] Cluster ID: {}", brokerName, clusterId));
  }

  @Override
  public Future<Void> close() {
    log.info("[{}] Closing Kafka admin client", brokerName);
    // Pending calls are aborted after the timeout
    return adminClient.close(CLOSE_TIMEOUT_MS)
      .onSuccess(v -> log.debug("[{}] Kafka admin client closed", brokerName))
      .onFailure(err -> log.error("[{}] Failed to close Kafka admin client", brokerName, err));
  }

  private PartitionInfo toPartitionInfo(String topic, TopicPartitionInfo tpi) {
    int leader = tpi.getLeader() == null ? -1 : tpi.getLeader().getId();
    return new PartitionInfo(topic, tpi.getPartition(), leader);
  }
}

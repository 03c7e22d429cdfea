package com.orderpipeline.infra.kafka.producer;

import com.orderpipeline.infra.kafka.topics.Channel;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public interface ChannelPublisher {
  CompletableFuture<SendResult<String, byte[]>> publish(
      Channel channel, String key, byte[] payload, Map<String, String> headers);
}

package com.xing.warren.spring;

import com.rabbitmq.client.ConnectionFactory;
import com.xing.warren.ConsumerConfiguration;
import com.xing.warren.MessageConsumer;
import com.xing.warren.MessageProcessor;
import com.xing.warren.QuarantinePublisher;
import com.xing.warren.dispatch.ExceptionClassifier;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Runs a {@link MessageConsumer} for the application's {@link MessageProcessor} bean. Quarantined
 * messages go to a {@link QuarantinePublisher} bean if there is one, else to {@code
 * warren.quarantine-queue}.
 */
@AutoConfiguration
@ConditionalOnClass(MessageConsumer.class)
@ConditionalOnBean(MessageProcessor.class)
@EnableConfigurationProperties(WarrenProperties.class)
public class WarrenAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  ConsumerConfiguration warrenConsumerConfiguration(WarrenProperties properties) {
    return properties.toConfiguration();
  }

  @Bean
  @ConditionalOnMissingBean
  ExceptionClassifier warrenExceptionClassifier() {
    return ExceptionClassifier.DEFAULT;
  }

  @Bean
  @ConditionalOnMissingBean
  MessageConsumer warrenMessageConsumer(
      ConsumerConfiguration configuration,
      MessageProcessor processor,
      ExceptionClassifier classifier,
      ObjectProvider<QuarantinePublisher> quarantinePublisher,
      ObjectProvider<ConnectionFactory> connectionFactory) {
    return MessageConsumer.builder()
        .configuration(configuration)
        .processor(processor)
        .classifier(classifier)
        .quarantinePublisher(quarantinePublisher.getIfUnique())
        .connectionFactory(connectionFactory.getIfUnique())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  WarrenConsumerLifecycle warrenConsumerLifecycle(
      MessageConsumer consumer, WarrenProperties properties) {
    return new WarrenConsumerLifecycle(
        consumer, properties.isAutoStartup(), properties.getShutdownTimeout());
  }
}

package com.solprofile.consumer;

import com.solprofile.config.BehaviorConfig;
import com.solprofile.service.BehaviorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * One wallet address per message; each message triggers a full-history analysis.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BehaviorQueueConsumer {

    private final BehaviorService behaviorService;

    @RabbitListener(queues = BehaviorConfig.BEHAVIOR_QUEUE, concurrency = "1-4",
            autoStartup = "${behavior.queue.auto-startup:true}")
    public void consumeWalletMessage(Message message) {
        String wallet = new String(message.getBody(), StandardCharsets.UTF_8).trim();
        log.info("Received wallet from '{}' queue: {}", BehaviorConfig.BEHAVIOR_QUEUE, wallet);
        if (wallet.isEmpty()) {
            log.warn("Ignoring empty wallet message");
            return;
        }
        behaviorService.analyzeWalletBehaviorSafely(wallet);
        log.info("Finished behavior analysis for wallet: {}", wallet);
    }
}

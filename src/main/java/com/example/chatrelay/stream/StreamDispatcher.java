package com.example.chatrelay.stream;

import com.example.chatrelay.model.ChatEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs ordered batches of change records through the subscribed stages.
 *
 * <ul>
 *   <li>MODIFY and REMOVE records are ignored.</li>
 *   <li>An INSERT whose image does not decode is logged and skipped.</li>
 *   <li>Every stage sees every decoded record, even when an earlier stage threw
 *       on it. The first failure then stops the batch with a
 *       {@link StreamDispatchException}; later records are left for redelivery.</li>
 * </ul>
 *
 * Stages are expected to be idempotent (see
 * {@link com.example.chatrelay.service.idempotency.IdempotentStage}) since a
 * redelivered batch replays records whose other stages already succeeded.
 */
public class StreamDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(StreamDispatcher.class);

    private final ChatEventMapper mapper;
    private final List<StreamStage> stages;

    public StreamDispatcher(ChatEventMapper mapper, List<StreamStage> stages) {
        this.mapper = mapper;
        this.stages = List.copyOf(stages);
    }

    public DispatchReport dispatch(List<StreamRecord> batch) {
        logger.info("Received stream batch with {} records", batch.size());
        DispatchReport report = new DispatchReport();

        for (int i = 0; i < batch.size(); i++) {
            StreamRecord record = batch.get(i);
            if (record.getEventName() != StreamEventName.INSERT) {
                logger.debug("Skipping non-INSERT record: {}", record.getEventName());
                report.ignored();
                continue;
            }

            ChatEvent event;
            try {
                event = mapper.fromItem(record.getChangeImage());
            } catch (DecodeException e) {
                logger.error("Failed to parse stream record {}: {}", i, e.getMessage());
                report.malformed();
                continue;
            }

            RuntimeException failure = null;
            String failedStage = null;
            for (StreamStage stage : stages) {
                try {
                    ProcessingOutcome outcome = stage.process(event);
                    logger.debug("Stage '{}' -> {} for event {}", stage.name(), outcome, event.getId());
                    report.record(i, event.getId(), stage.name(), outcome);
                } catch (RuntimeException e) {
                    logger.error("Stage '{}' failed for event {}", stage.name(), event.getId(), e);
                    report.record(i, event.getId(), stage.name(), ProcessingOutcome.FAILED);
                    if (failure == null) {
                        failure = e;
                        failedStage = stage.name();
                    }
                }
            }
            if (failure != null) {
                throw new StreamDispatchException(failedStage, i, report, failure);
            }
        }
        return report;
    }
}

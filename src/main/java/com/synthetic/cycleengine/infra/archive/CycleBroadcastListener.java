package com.synthetic.cycleengine.infra.archive;

import com.synthetic.cycleengine.domain.model.CycleTransition;
import com.synthetic.cycleengine.domain.service.CycleEventListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class CycleBroadcastListener implements CycleEventListener {

    static final String TOPIC_PREFIX = "/topic/cycle/";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onTransition(CycleTransition transition) {
        String destination = TOPIC_PREFIX + transition.symbol();
        messagingTemplate.convertAndSend(destination, transition);
        log.debug("[Broadcast] {} {} -> {} sent to {}",
                transition.symbol(), transition.from(), transition.to(), destination);
    }
}

package com.raava.concierge.completion.service;

import com.raava.concierge.exception.TextCompletionException;
import com.raava.concierge.session.model.ConversationTurn;

import java.util.List;

/**
 * Natural-language generation used for routing fallbacks and reply wording.
 * Never consulted for slot values or record creation.
 */
public interface TextCompletionClient {

    /**
     * @param systemContext instructions for the model
     * @param turns         conversation so far, oldest first; the last turn's message is the one to answer
     * @return generated text
     * @throws TextCompletionException if the service fails, times out or is not configured
     */
    String complete(String systemContext, List<ConversationTurn> turns);
}

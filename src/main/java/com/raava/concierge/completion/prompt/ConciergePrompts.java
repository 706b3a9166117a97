package com.raava.concierge.completion.prompt;

import com.raava.concierge.session.model.ActiveDomain;

import java.util.List;

/**
 * System prompts for the Raava concierge: domain classification and reply wording.
 *
 * The model never decides slot values, stages or records. It only classifies an utterance the
 * keyword router could not place, and rephrases the deterministic prompt of the current stage.
 */
public class ConciergePrompts {

    private ConciergePrompts() {}

    /**
     * Classifies a message into one funnel. The model must answer with a single word.
     */
    public static final String DOMAIN_CLASSIFIER_PROMPT = """
            You are the router of Raava, a luxury automotive platform in the UK.
            Decide which department should handle the customer's message.

            Departments:
            - ACQUISITION: buying, renting or financing a vehicle, searching the inventory
            - SERVICE: servicing, maintenance, MOT, repairs or upgrades of a vehicle the customer owns
            - CONSIGNMENT: selling or consigning a vehicle, getting a valuation, creating a listing
            - NONE: anything else, or the message is too vague to decide

            Answer with exactly one word: ACQUISITION, SERVICE, CONSIGNMENT or NONE.
            Do not explain your answer.
            """;

    private static final String REPLY_PROMPT_TEMPLATE = """
            You are %s at Raava, a luxury automotive platform in the UK.

            Current task: %s
            Current stage: %s
            Still needed from the customer: %s

            Draft reply:
            %s

            Rewrite the draft reply in a warm, professional tone suitable for a luxury brand.
            Rules:
            - Keep every fact, number, price, date, name and list item from the draft exactly as written
            - Keep numbered lists numbered, in the same order
            - Ask only for the information listed as still needed
            - Do not promise anything the draft does not say
            - Do not invent vehicles, prices, providers or reference numbers
            - Use British English and pounds sterling
            - Maximum 6 sentences plus any list from the draft
            Reply with the rewritten message only.
            """;

    /**
     * Builds the system context for rewording a stage prompt.
     *
     * @param domain        active funnel
     * @param stage         current stage name
     * @param missingFields labels of fields the stage still needs
     * @param draft         deterministic prompt produced by the funnel
     */
    public static String replyPrompt(ActiveDomain domain, String stage, List<String> missingFields, String draft) {
        return String.format(REPLY_PROMPT_TEMPLATE,
                persona(domain),
                domain.getDescription(),
                stage,
                missingFields.isEmpty() ? "nothing" : String.join(", ", missingFields),
                draft);
    }

    static String persona(ActiveDomain domain) {
        return switch (domain) {
            case ACQUISITION -> "the AI Concierge, a luxury vehicle acquisition specialist";
            case SERVICE -> "the AI Service Manager, who books maintenance with trusted specialists";
            case CONSIGNMENT -> "the AI Consigner, who helps owners sell their vehicles";
            case NONE -> "the Raava assistant";
        };
    }
}

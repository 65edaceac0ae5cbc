package com.williamcallahan.agentbridge.domain.completion;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * OpenAI model listing payload.
 *
 * @param object always {@code list}
 * @param data advertised models
 */
public record ModelList(String object, List<ModelCard> data) {

    public static ModelList of(List<ModelCard> models) {
        return new ModelList("list", List.copyOf(models));
    }

    /**
     * One advertised backend adapter.
     */
    public record ModelCard(String id, String object, long created, @JsonProperty("owned_by") String ownedBy) {

        public static ModelCard of(String id, long created, String ownedBy) {
            return new ModelCard(id, "model", created, ownedBy);
        }
    }
}

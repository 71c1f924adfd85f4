package com.libragraph.backup.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.backup.archivers.store.InteractionStoreException;
import com.libragraph.backup.core.dao.InteractionKind;
import com.libragraph.backup.core.dao.InteractionRecord;
import com.libragraph.backup.types.model.Interaction;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Maps interactions to and from the JSONB {@code payload} column.
 * The row id lives in its own column and is applied on decode.
 */
@ApplicationScoped
public class InteractionCodec {

    @Inject
    ObjectMapper objectMapper;

    private ObjectMapper mapper;

    @PostConstruct
    void init() {
        mapper = objectMapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** Builds a codec outside the container. */
    public static InteractionCodec of(ObjectMapper objectMapper) {
        InteractionCodec codec = new InteractionCodec();
        codec.objectMapper = objectMapper;
        codec.init();
        return codec;
    }

    public String encode(Interaction interaction) {
        try {
            return mapper.writeValueAsString(interaction);
        } catch (JsonProcessingException e) {
            throw new InteractionStoreException("Cannot encode " + interaction.chatItemId(), e);
        }
    }

    public Interaction decode(InteractionRecord record) {
        InteractionKind kind = InteractionKind.fromId(record.kind());
        try {
            return mapper.readValue(record.payload(), kind.type()).withRowId(record.id());
        } catch (JsonProcessingException e) {
            throw new InteractionStoreException("Cannot decode interaction row " + record.id(), e);
        }
    }
}

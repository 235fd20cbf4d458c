package com.overlaychat.server.model;

/**
 * Data part of an outbound overlay message. Each shape is bound to exactly one command.
 */
public sealed interface Payload permits TextPayload, GiftPayload, MemberPayload {

    Command command();
}

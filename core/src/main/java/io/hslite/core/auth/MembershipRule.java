// file: core/src/main/java/io/hslite/core/auth/MembershipRule.java
package io.hslite.core.auth;

import io.hslite.core.Membership;
import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;

import static io.hslite.core.auth.AuthDecision.allow;
import static io.hslite.core.auth.AuthDecision.reject;

/**
 * {@code m.room.member}: the membership state machine.
 * <pre>
 *   (none|leave|invite) --join (self)--> join      needs public room or a pending invite
 *   (none|leave)        --invite-------> invite    sender joined, power >= invite
 *   (invite|join)       --leave (self)-> leave
 *   join                --leave (kick)-> leave     power >= kick and above target
 *   ban                 --leave (unban)> leave     power >= ban
 *   any                 --ban----------> ban       power >= ban and above target
 * </pre>
 */
final class MembershipRule implements AuthRule {

    @Override
    public AuthDecision check(RoomEvent event, AuthState state, RoomVersion version) {
        String target = event.stateKey();
        if (target == null || !target.startsWith("@")) {
            return reject("member event state_key must be a user id");
        }
        Membership membership = Membership.fromContent(event.content());
        if (membership == null) {
            return reject("unknown membership " + event.contentField("membership"));
        }
        RoomEvent create = state.create();
        String creator = version.creator(create);
        if (membership == Membership.JOIN
                && event.prevEvents().size() == 1
                && event.prevEvents().get(0).equals(create.eventId())
                && target.equals(creator)
                && event.sender().equals(creator)) {
            return allow();
        }

        Membership senderMembership = state.membership(event.sender());
        Membership targetMembership = state.membership(target);
        PowerLevels pl = state.powerLevels(version);
        int senderLevel = pl.userLevel(event.sender());
        int targetLevel = pl.userLevel(target);

        switch (membership) {
            case JOIN -> {
                if (!event.sender().equals(target)) {
                    return reject("cannot join on behalf of another user");
                }
                if (targetMembership == Membership.BAN) {
                    return reject(target + " is banned");
                }
                String rule = state.joinRule();
                if ("public".equals(rule)) {
                    return allow();
                }
                if (targetMembership == Membership.INVITE || targetMembership == Membership.JOIN) {
                    return allow();
                }
                return reject("join rule is " + rule + " and " + target + " is not invited");
            }
            case INVITE -> {
                if (senderMembership != Membership.JOIN) {
                    return reject(event.sender() + " is not joined");
                }
                if (targetMembership == Membership.JOIN || targetMembership == Membership.BAN) {
                    return reject(target + " is already " + targetMembership.wire());
                }
                if (senderLevel < pl.invite()) {
                    return reject("power " + senderLevel + " below invite level " + pl.invite());
                }
                return allow();
            }
            case LEAVE -> {
                if (event.sender().equals(target)) {
                    return (senderMembership == Membership.INVITE
                            || senderMembership == Membership.JOIN
                            || senderMembership == Membership.KNOCK)
                            ? allow()
                            : reject(target + " cannot leave from " + describe(senderMembership));
                }
                if (senderMembership != Membership.JOIN) {
                    return reject(event.sender() + " is not joined");
                }
                if (targetMembership == Membership.BAN) {
                    return senderLevel >= pl.ban()
                            ? allow()
                            : reject("power " + senderLevel + " below ban level " + pl.ban());
                }
                if (senderLevel >= pl.kick() && targetLevel < senderLevel) {
                    return allow();
                }
                return reject("insufficient power to kick " + target);
            }
            case BAN -> {
                if (senderMembership != Membership.JOIN) {
                    return reject(event.sender() + " is not joined");
                }
                if (senderLevel >= pl.ban() && targetLevel < senderLevel) {
                    return allow();
                }
                return reject("insufficient power to ban " + target);
            }
            default -> {
                return reject("membership " + membership.wire() + " is not supported");
            }
        }
    }

    private static String describe(Membership m) {
        return m == null ? "no membership" : m.wire();
    }
}

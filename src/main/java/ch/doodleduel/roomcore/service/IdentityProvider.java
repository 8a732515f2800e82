package ch.doodleduel.roomcore.service;

/**
 * Yields the stable anonymous id of this device. The id is valid before any room operation starts.
 */
public interface IdentityProvider {

    String currentPlayerId();
}

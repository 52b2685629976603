package devicevault.pipeline.model;

/**
 * Partition of devices whose collection jobs go to a dedicated queue.
 *
 * @param id   group ID, also the queue suffix
 * @param name display name
 */
public record CollectionGroup(long id, String name) {
}

package ch.doodleduel.roomcore.dto;

/**
 * Outcome of one reaper pass.
 *
 * @param roomsDeleted rooms removed because they outlived the retention window
 * @param artifactsDeleted artifacts removed, of aged rooms and orphans alike
 * @param failures items that could not be removed and were skipped
 */
public record ReaperResultDto(
        int roomsDeleted,
        int artifactsDeleted,
        int failures
) {

    public static ReaperResultDto empty() {
        return new ReaperResultDto(0, 0, 0);
    }
}

package devicevault.pipeline.api.v1;

final class PathIds {

    private PathIds() {
    }

    static long parse(String raw, String what) {
        try {
            long id = Long.parseLong(raw);
            if (id <= 0) {
                throw new IllegalArgumentException("invalid " + what + " id: " + raw);
            }
            return id;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + what + " id: " + raw);
        }
    }
}

package org.example.mjcf;

/** The assembly uses a joint feature this exporter has no conversion rule for. */
public class UnsupportedFeatureException extends ExportException {

    public UnsupportedFeatureException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "unsupported";
    }
}

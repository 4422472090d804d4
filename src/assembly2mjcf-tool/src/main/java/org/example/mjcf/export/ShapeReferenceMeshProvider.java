package org.example.mjcf.export;

import org.example.mjcf.ConfigurationException;
import org.example.mjcf.model.Part;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Uses the file name of the part's shape reference, or {@code <part>.stl}
 * when the part carries no shape reference.
 */
public class ShapeReferenceMeshProvider implements MeshProvider {

    static final String DEFAULT_EXTENSION = ".stl";

    @Override
    public String meshFile(Part part) {
        if (part.shape() == null || part.shape().isBlank()) {
            return part.name() + DEFAULT_EXTENSION;
        }

        Path fileName;
        try {
            fileName = Path.of(part.shape()).getFileName();
        } catch (InvalidPathException e) {
            throw new ConfigurationException("Part '" + part.name() + "' has an invalid shape reference '"
                + part.shape() + "': " + e.getMessage(), e);
        }
        if (fileName == null) {
            throw new ConfigurationException("Shape reference '" + part.shape() + "' of part '"
                + part.name() + "' does not name a file");
        }
        return fileName.toString();
    }
}

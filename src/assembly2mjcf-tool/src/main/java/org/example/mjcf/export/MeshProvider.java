package org.example.mjcf.export;

import org.example.mjcf.model.Part;

/**
 * Geometry collaborator: knows which mesh file holds the tessellated shape of
 * a part. The exporter only references the file by name; producing it is the
 * provider's job.
 */
public interface MeshProvider {

    /** Mesh file name relative to the model's mesh directory. */
    String meshFile(Part part);
}

package org.octconverter.cli.report;

import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;

import org.octconverter.model.Contour;
import org.octconverter.model.DecodeWarning;
import org.octconverter.model.Decoded;
import org.octconverter.model.DeviceMetadata;
import org.octconverter.model.FundusImage;
import org.octconverter.model.OctVolume;
import org.octconverter.model.PatientMetadata;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * What {@code inspect} prints for one file: the decoded entities without their pixels.
 *
 * @param source  file name
 * @param format  reader format name
 * @param volumes decoded volumes
 * @param fundus  decoded fundus images
 */
public record DecodeReport(String source, String format, List<Decoded<OctVolume>> volumes,
                           List<Decoded<FundusImage>> fundus) {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public String toJson() {
        JsonObject root = new JsonObject();
        root.addProperty("source", source);
        root.addProperty("format", format);
        JsonArray volumeArray = new JsonArray();
        for (Decoded<OctVolume> decoded : volumes) {
            OctVolume volume = decoded.value();
            JsonObject json = new JsonObject();
            json.addProperty("volumeId", volume.volumeId());
            json.addProperty("slices", volume.sliceCount());
            json.addProperty("width", volume.width());
            json.addProperty("height", volume.height());
            json.addProperty("bitDepth", volume.bitDepth());
            json.addProperty("laterality", volume.laterality().name());
            json.add("missingSlices", GSON.toJsonTree(volume.missingSliceIndices()));
            json.addProperty("acquired", volume.acquisitionDateTime().map(Object::toString).orElse(null));
            json.add("patient", patient(volume.patient()));
            json.add("device", device(volume.device()));
            volume.pixelSpacing().ifPresent(s -> json.add("pixelSpacing", GSON.toJsonTree(s)));
            JsonArray contours = new JsonArray();
            for (Contour contour : volume.contours()) {
                contours.add(contour.name());
            }
            json.add("contours", contours);
            json.add("warnings", warnings(decoded.warnings()));
            volumeArray.add(json);
        }
        root.add("volumes", volumeArray);

        JsonArray fundusArray = new JsonArray();
        for (Decoded<FundusImage> decoded : fundus) {
            FundusImage image = decoded.value();
            JsonObject json = new JsonObject();
            json.addProperty("imageId", image.imageId());
            json.addProperty("width", image.width());
            json.addProperty("height", image.height());
            json.addProperty("color", image.plane().isColor());
            json.addProperty("laterality", image.laterality().name());
            json.addProperty("acquired", image.acquisitionTime().map(Object::toString).orElse(null));
            json.add("patient", patient(Optional.ofNullable(image.patient())));
            json.add("device", device(Optional.ofNullable(image.device())));
            json.add("warnings", warnings(decoded.warnings()));
            fundusArray.add(json);
        }
        root.add("fundus", fundusArray);
        return GSON.toJson(root);
    }

    public void printSummary(PrintWriter out) {
        out.println("=== " + source + " (" + format + ") ===");
        out.println("OCT volumes: " + volumes.size());
        for (Decoded<OctVolume> decoded : volumes) {
            OctVolume volume = decoded.value();
            out.println("  " + volume.volumeId() + ": " + volume.sliceCount() + " slices of " + volume.geometry()
                    + ", " + volume.laterality());
            volume.acquisitionDateTime().ifPresent(t -> out.println("    acquired: " + t));
            volume.patient().ifPresent(p -> out.println("    patient: " + p));
            volume.device().ifPresent(d -> out.println("    device: " + d));
            volume.pixelSpacing().ifPresent(s -> out.println("    spacing: " + s));
            if (!volume.missingSliceIndices().isEmpty()) {
                out.println("    missing slices: " + volume.missingSliceIndices());
            }
            if (!volume.contours().isEmpty()) {
                out.println("    contours: " + volume.contours().size());
            }
            printWarnings(out, decoded.warnings());
        }
        out.println("Fundus images: " + fundus.size());
        for (Decoded<FundusImage> decoded : fundus) {
            FundusImage image = decoded.value();
            out.println("  " + image.imageId() + ": " + image.plane().geometry() + ", " + image.laterality());
            image.acquisitionTime().ifPresent(t -> out.println("    acquired: " + t));
            printWarnings(out, decoded.warnings());
        }
        out.flush();
    }

    private static void printWarnings(PrintWriter out, List<DecodeWarning> warnings) {
        for (DecodeWarning warning : warnings) {
            out.println("    warning: " + warning);
        }
    }

    private static JsonObject patient(Optional<PatientMetadata> patient) {
        if (patient.isEmpty()) {
            return null;
        }
        PatientMetadata p = patient.get();
        JsonObject json = new JsonObject();
        json.addProperty("patientId", p.patientId());
        json.addProperty("firstName", p.firstName());
        json.addProperty("surname", p.surname());
        json.addProperty("sex", p.sex() != null ? p.sex().name() : null);
        json.addProperty("birthDate", p.birthDate() != null ? p.birthDate().toString() : null);
        return json;
    }

    private static JsonObject device(Optional<DeviceMetadata> device) {
        return device.map(d -> GSON.toJsonTree(d).getAsJsonObject()).orElse(null);
    }

    private static JsonArray warnings(List<DecodeWarning> warnings) {
        JsonArray array = new JsonArray();
        for (DecodeWarning warning : warnings) {
            JsonObject json = new JsonObject();
            json.addProperty("kind", warning.kind().name());
            json.addProperty("message", warning.message());
            json.addProperty("offset", warning.offset() >= 0 ? warning.offset() : null);
            json.addProperty("tag", warning.tag());
            array.add(json);
        }
        return array;
    }
}

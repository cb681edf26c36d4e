package org.octconverter.model;

/**
 * Acquisition device description. Only {@code manufacturer} is always known (it follows from
 * the file format); the other components are {@code null} when absent.
 *
 * @param manufacturer    device vendor
 * @param model           model name
 * @param serialNumber    serial number
 * @param softwareVersion acquisition software version
 */
public record DeviceMetadata(String manufacturer, String model, String serialNumber, String softwareVersion) {

    public static DeviceMetadata of(String manufacturer) {
        return new DeviceMetadata(manufacturer, null, null, null);
    }
}

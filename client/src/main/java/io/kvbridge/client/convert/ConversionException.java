// file: src/main/java/io/kvbridge/client/convert/ConversionException.java
package io.kvbridge.client.convert;

/** A native value that has no representation in the dynamic object model. */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }
}

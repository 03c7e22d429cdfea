package com.orderpipeline.infra.kafka.serde;

import com.orderpipeline.infra.kafka.contract.OrderRecord;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.EncoderFactory;

public class OrderAvroCodec {
  public static final String SCHEMA_RESOURCE = "avro/order.avsc";

  static final String FIELD_ORDER_ID = "orderId";
  static final String FIELD_PRODUCT = "product";
  static final String FIELD_PRICE = "price";

  private final Schema schema;
  private final GenericDatumWriter<GenericRecord> writer;
  private final GenericDatumReader<GenericRecord> reader;

  public OrderAvroCodec() {
    this(loadSchema(SCHEMA_RESOURCE));
  }

  public OrderAvroCodec(Schema schema) {
    this.schema = Objects.requireNonNull(schema, "schema must not be null");
    this.writer = new GenericDatumWriter<>(schema);
    this.reader = new GenericDatumReader<>(schema);
  }

  public Schema schema() {
    return schema;
  }

  public byte[] encode(OrderRecord order) {
    if (order == null) {
      throw new SchemaViolationException(null, "order must not be null");
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(FIELD_ORDER_ID, order.orderId());
    fields.put(FIELD_PRODUCT, order.product());
    fields.put(FIELD_PRICE, order.price());
    return encodeFields(fields);
  }

  public byte[] encodeFields(Map<String, ?> fields) {
    if (fields == null) {
      throw new SchemaViolationException(null, "order fields must not be null");
    }
    for (String name : fields.keySet()) {
      if (schema.getField(name) == null) {
        throw new SchemaViolationException(name, "Unknown order field: " + name);
      }
    }

    GenericRecord record = new GenericData.Record(schema);
    for (Schema.Field field : schema.getFields()) {
      Object value = fields.get(field.name());
      if (value == null) {
        throw new SchemaViolationException(
            field.name(), "Missing required order field: " + field.name());
      }
      if (!GenericData.get().validate(field.schema(), value)) {
        throw new SchemaViolationException(
            field.name(),
            "Order field "
                + field.name()
                + " expects "
                + field.schema().getType().getName()
                + " but was "
                + value.getClass().getSimpleName());
      }
      record.put(field.name(), value);
    }

    OrderRecord order = toOrderRecord(record);
    String invalidField = invalidField(order);
    if (invalidField != null) {
      throw new SchemaViolationException(
          invalidField, "Order field " + invalidField + " is out of range: " + order);
    }
    return write(record);
  }

  public OrderRecord decode(byte[] payload) {
    if (payload == null || payload.length == 0) {
      throw new OrderDecodeException("Order payload is empty");
    }
    OrderRecord order;
    try {
      checkDeclaredLengths(payload);
      BinaryDecoder decoder = DecoderFactory.get().binaryDecoder(payload, null);
      GenericRecord record = reader.read(null, decoder);
      if (!decoder.isEnd()) {
        throw new OrderDecodeException(
            "Order payload has trailing bytes after the record, length=" + payload.length);
      }
      order = toOrderRecord(record);
    } catch (OrderDecodeException ex) {
      throw ex;
    } catch (IOException | RuntimeException ex) {
      throw new OrderDecodeException(
          "Failed to decode order payload, length=" + payload.length, ex);
    }

    String invalidField = invalidField(order);
    if (invalidField != null) {
      throw new OrderDecodeException(
          "Decoded order has invalid field " + invalidField + ": " + order);
    }
    return order;
  }

  private void checkDeclaredLengths(byte[] payload) throws IOException {
    ByteArrayInputStream in = new ByteArrayInputStream(payload);
    BinaryDecoder decoder = DecoderFactory.get().directBinaryDecoder(in, null);
    for (Schema.Field field : schema.getFields()) {
      Schema.Type type = field.schema().getType();
      if (type == Schema.Type.STRING || type == Schema.Type.BYTES) {
        long length = decoder.readLong();
        if (length < 0L || length > in.available()) {
          throw new OrderDecodeException(
              "Order field "
                  + field.name()
                  + " declares length "
                  + length
                  + " beyond payload, length="
                  + payload.length);
        }
        decoder.skipFixed((int) length);
      } else if (type == Schema.Type.DOUBLE) {
        decoder.skipFixed(Double.BYTES);
      } else {
        return;
      }
    }
  }

  private byte[] write(GenericRecord record) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(64);
    BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
    try {
      writer.write(record, encoder);
      encoder.flush();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode order", ex);
    }
    return out.toByteArray();
  }

  private static OrderRecord toOrderRecord(GenericRecord record) {
    return new OrderRecord(
        asString(record.get(FIELD_ORDER_ID)),
        asString(record.get(FIELD_PRODUCT)),
        ((Number) record.get(FIELD_PRICE)).doubleValue());
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  private static String invalidField(OrderRecord order) {
    if (order.orderId() == null || order.orderId().isBlank()) {
      return FIELD_ORDER_ID;
    }
    if (order.product() == null) {
      return FIELD_PRODUCT;
    }
    if (Double.isNaN(order.price()) || Double.isInfinite(order.price()) || order.price() < 0.0d) {
      return FIELD_PRICE;
    }
    return null;
  }

  private static Schema loadSchema(String resource) {
    ClassLoader classLoader = OrderAvroCodec.class.getClassLoader();
    try (InputStream in = classLoader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Order schema resource not found: " + resource);
      }
      return new Schema.Parser().parse(in);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to load order schema " + resource, ex);
    }
  }
}

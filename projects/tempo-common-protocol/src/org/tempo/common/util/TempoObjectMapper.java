package org.tempo.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.tempo.common.TempoException;

/**
 * The object mapper used for every JSON answer and input file:
 * indented output with map entries in key order.
 */
public class TempoObjectMapper extends ObjectMapper {

   private static final long serialVersionUID = 1L;

   public TempoObjectMapper() {
      enable(SerializationFeature.INDENT_OUTPUT);
      enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
   }

   public static String writePrettyString(Object o) {
      try {
         return new TempoObjectMapper().writeValueAsString(o);
      }
      catch (JsonProcessingException e) {
         throw new TempoException("Failed to serialize "
               + o.getClass().getSimpleName() + " to JSON", e);
      }
   }

}

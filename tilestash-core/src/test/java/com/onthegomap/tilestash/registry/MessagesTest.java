package com.onthegomap.tilestash.registry;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Locale;
import org.junit.jupiter.api.Test;

class MessagesTest {

  @Test
  void testPortuguese() {
    Messages messages = Messages.forLocale(Locale.forLanguageTag("pt-BR"));
    assertEquals("Sem conexão com a internet", messages.noConnection());
    assertEquals("Falha ao baixar", messages.downloadFailed());
    assertEquals("Download interrompido. Clique para tentar novamente.", messages.interrupted());
    assertEquals("Erro desconhecido", messages.unknownError());
  }

  @Test
  void testEnglish() {
    Messages messages = Messages.forLocale(Locale.ENGLISH);
    assertEquals("No internet connection", messages.noConnection());
    assertEquals("Download failed", messages.downloadFailed());
    assertEquals("Download interrupted. Click to try again.", messages.interrupted());
    assertEquals("Unknown error", messages.unknownError());
  }

  @Test
  void testUnknownLocaleFallsBackToEnglish() {
    assertEquals("Unknown error", Messages.forLocale(Locale.JAPANESE).unknownError());
  }
}

module se.alipsa.gotoimpl.core {
  requires org.slf4j;

  exports se.alipsa.gotoimpl.core;
  exports se.alipsa.gotoimpl.core.command;
  exports se.alipsa.gotoimpl.core.host;
  exports se.alipsa.gotoimpl.core.model;
  exports se.alipsa.gotoimpl.core.presentation;
  exports se.alipsa.gotoimpl.core.server;
  exports se.alipsa.gotoimpl.core.service;

  uses se.alipsa.gotoimpl.core.LanguagePlugin;
}

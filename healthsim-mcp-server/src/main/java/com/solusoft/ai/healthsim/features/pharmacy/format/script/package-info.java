/**
 * JAXB bindings for the subset of NCPDP SCRIPT used by NewRx and electronic prior authorization.
 */
@XmlSchema(namespace = "http://www.ncpdp.org/schema/SCRIPT", elementFormDefault = XmlNsForm.QUALIFIED)
package com.solusoft.ai.healthsim.features.pharmacy.format.script;

import jakarta.xml.bind.annotation.XmlNsForm;
import jakarta.xml.bind.annotation.XmlSchema;

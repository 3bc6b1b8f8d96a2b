package com.github.k8soperators.secretsync.api.generators.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "length", "digits", "symbols", "symbolCharacters", "noUpper", "allowRepeat" })
public class PasswordSpec {

    Integer length;
    Integer digits;
    Integer symbols;
    String symbolCharacters;
    Boolean noUpper;
    Boolean allowRepeat;

    public Integer getLength() {
        return length;
    }

    public void setLength(Integer length) {
        this.length = length;
    }

    public Integer getDigits() {
        return digits;
    }

    public void setDigits(Integer digits) {
        this.digits = digits;
    }

    public Integer getSymbols() {
        return symbols;
    }

    public void setSymbols(Integer symbols) {
        this.symbols = symbols;
    }

    public String getSymbolCharacters() {
        return symbolCharacters;
    }

    public void setSymbolCharacters(String symbolCharacters) {
        this.symbolCharacters = symbolCharacters;
    }

    public Boolean getNoUpper() {
        return noUpper;
    }

    public void setNoUpper(Boolean noUpper) {
        this.noUpper = noUpper;
    }

    public Boolean getAllowRepeat() {
        return allowRepeat;
    }

    public void setAllowRepeat(Boolean allowRepeat) {
        this.allowRepeat = allowRepeat;
    }
}

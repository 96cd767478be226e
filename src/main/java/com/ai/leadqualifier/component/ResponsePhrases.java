package com.ai.leadqualifier.component;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

@Component
public class ResponsePhrases {

    public String handoff(String name, String additionalInfo) {
        StringBuilder sb = new StringBuilder(greeting(name));
        sb.append("\n\nJá tenho todas as informações necessárias. ")
          .append("Um de nossos especialistas vai entrar em contato com você em breve para dar continuidade.");
        if (StringUtils.isNotBlank(additionalInfo)) {
            sb.append("\n\n").append(additionalInfo.trim());
        }
        sb.append("\n\nObrigado pela paciência!");
        return sb.toString();
    }

    public String escalation(String name) {
        return greeting(name) + "\n\nVou transferir você agora para um de nossos atendentes. "
                + "Em instantes alguém da equipe continua esta conversa com você.";
    }

    public String disqualification(String name, String reason, String alternative) {
        StringBuilder sb = new StringBuilder();
        sb.append(StringUtils.isNotBlank(name) ? "Entendo, " + name.trim() + "." : "Entendo.");
        if (StringUtils.isNotBlank(reason)) sb.append(' ').append(reason.trim());
        if (StringUtils.isNotBlank(alternative)) sb.append("\n\n").append(alternative.trim());
        sb.append("\n\nSe precisar de algo no futuro, estamos à disposição!");
        return sb.toString();
    }

    public String disqualificationReason() {
        return "No momento não conseguimos seguir com o seu atendimento por aqui.";
    }

    public String disqualificationAlternative() {
        return "Você pode nos chamar novamente quando quiser.";
    }

    public String timeout(String name) {
        return (StringUtils.isNotBlank(name) ? "Olá, " + name.trim() + "! " : "Olá! ")
                + "Como não tivemos retorno, encerramos este atendimento. "
                + "Nossa equipe recebeu o seu contato e pode falar com você em breve.";
    }

    public String fallback() {
        return "Desculpe, tive um problema técnico. Pode repetir sua mensagem?";
    }

    public String alreadyWithTeam() {
        return "Seu atendimento já está com a nossa equipe. Em breve alguém entrará em contato!";
    }

    private static String greeting(String name) {
        return StringUtils.isNotBlank(name) ? "Perfeito, " + name.trim() + "! 👍" : "Perfeito! 👍";
    }
}
